package com.doccrawler.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 크롤 1회의 요약.
 *
 * @param visitedUrls VisitedSet 순서 그대로(시도 순서)
 * @param interrupted 스레드 인터럽트로 도중에 멈췄는지
 */
public record CrawlReport(
        URI seed,
        Instant startedAt,
        Duration elapsed,
        Integer maxPages,
        Duration politenessDelay,
        boolean robotsFallback,
        CrawlStats.Snapshot stats,
        List<String> visitedUrls,
        Path output,
        boolean interrupted) {

    public CrawlReport {
        visitedUrls = (visitedUrls == null) ? List.of() : List.copyOf(visitedUrls);
    }

    public int pagesVisited()  { return visitedUrls.size(); }
    public int pagesRecorded() { return stats.pagesRecorded; }
    public int pagesFailed()   { return stats.pagesFailed; }

    public boolean recordedAnything() { return stats.pagesRecorded > 0; }
}
