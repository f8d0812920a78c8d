package com.doccrawler.core.sink;

import com.doccrawler.core.api.IContentSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 페이지마다 파일 하나. 이름은 URL 경로에서:
 * 첫 세그먼트 이후를 '_' 로 잇고, 페이지 접미사 제거, 안전하지 않은 문자 치환, 비면 "index", 확장자 .txt.
 * 이름이 겹치면 덮어쓴다(두 번째부터 WARN).
 */
public final class PerPageFileSink implements IContentSink {
    private static final Logger log = LoggerFactory.getLogger(PerPageFileSink.class);

    private final Path dir;
    private final String pageSuffix;
    private final Set<String> produced = new HashSet<>();

    public PerPageFileSink(Path dir, String pageSuffix) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.pageSuffix = pageSuffix == null ? "" : pageSuffix.toLowerCase(Locale.ROOT);
    }

    @Override
    public synchronized void record(URI url, String text) throws IOException {
        String name = fileNameFor(url);
        if (!produced.add(name)) {
            log.warn("{} maps to already written file {}; overwriting", url, name);
        }
        Files.writeString(dir.resolve(name), text, StandardCharsets.UTF_8);
    }

    String fileNameFor(URI url) {
        String path = url.getPath() == null ? "" : url.getPath();
        List<String> segments = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) segments.add(s);
        }
        String joined = segments.size() <= 1 ? "" : String.join("_", segments.subList(1, segments.size()));
        if (!pageSuffix.isEmpty() && joined.toLowerCase(Locale.ROOT).endsWith(pageSuffix)) {
            joined = joined.substring(0, joined.length() - pageSuffix.length());
        }
        joined = joined.replaceAll("[^A-Za-z0-9._-]", "_");
        if (joined.isEmpty() || joined.chars().allMatch(c -> c == '.')) joined = "index";
        return joined + ".txt";
    }

    @Override
    public Path location() {
        return dir;
    }
}
