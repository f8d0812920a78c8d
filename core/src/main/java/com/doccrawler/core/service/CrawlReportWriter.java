package com.doccrawler.core.service;

import com.doccrawler.core.model.CrawlReport;
import com.doccrawler.core.model.CrawlScope;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static com.doccrawler.core.util.JsonUtil.esc;
import static com.doccrawler.core.util.JsonUtil.kv;

/** crawl-report.json 작성기. 실행마다 덮어쓴다 */
public final class CrawlReportWriter {

    public static final String FILE_NAME = "crawl-report.json";

    public Path write(CrawlReport report, Path dir) throws IOException {
        Files.createDirectories(dir);
        Path out = dir.resolve(FILE_NAME);
        Files.writeString(out, toJson(report), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return out;
    }

    static String toJson(CrawlReport r) {
        CrawlScope scope = CrawlScope.of(r.seed());
        StringBuilder sb = new StringBuilder(512);
        sb.append("{\n")
          .append("  ").append(kv("seed", r.seed().toString())).append(",\n")
          .append("  ").append(kv("baseDomain", scope.baseDomain())).append(",\n")
          .append("  ").append(kv("library", scope.libraryName())).append(",\n")
          .append("  ").append(kv("startedAt", r.startedAt().toString())).append(",\n")
          .append("  ").append(kv("elapsedMs", r.elapsed().toMillis())).append(",\n")
          .append("  \"maxPages\": ").append(r.maxPages() == null ? "null" : r.maxPages()).append(",\n")
          .append("  ").append(kv("politenessDelayMs", r.politenessDelay().toMillis())).append(",\n")
          .append("  ").append(kv("robotsFallback", r.robotsFallback())).append(",\n")
          .append("  ").append(kv("interrupted", r.interrupted())).append(",\n")
          .append("  \"pages\": { ")
          .append(kv("visited", r.pagesVisited())).append(", ")
          .append(kv("recorded", r.pagesRecorded())).append(", ")
          .append(kv("failed", r.pagesFailed())).append(", ")
          .append(kv("fetchAttempts", r.stats().fetchAttempts)).append(", ")
          .append(kv("linksDiscovered", r.stats().linksDiscovered))
          .append(" },\n")
          .append("  \"output\": ").append(r.output() == null ? "null" : esc(r.output().toString())).append(",\n")
          .append("  \"visitedUrls\": [");
        for (int i = 0; i < r.visitedUrls().size(); i++) {
            sb.append(i == 0 ? "\n    " : ",\n    ").append(esc(r.visitedUrls().get(i)));
        }
        sb.append(r.visitedUrls().isEmpty() ? "]\n" : "\n  ]\n");
        sb.append("}\n");
        return sb.toString();
    }
}
