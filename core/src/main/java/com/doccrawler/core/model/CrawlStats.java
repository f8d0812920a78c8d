package com.doccrawler.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicInteger fetchAttempts = new AtomicInteger(0);
    private final AtomicInteger pagesRecorded = new AtomicInteger(0);
    private final AtomicInteger pagesFailed   = new AtomicInteger(0);
    private final AtomicLong linksDiscovered  = new AtomicLong(0);

    public void fetchAttempted()         { fetchAttempts.incrementAndGet(); }
    public void pageRecorded()           { pagesRecorded.incrementAndGet(); }
    public void pageFailed()             { pagesFailed.incrementAndGet(); }
    public void linksDiscovered(int n)   { linksDiscovered.addAndGet(n); }

    public Snapshot snapshot() {
        return new Snapshot(fetchAttempts.get(), pagesRecorded.get(), pagesFailed.get(), linksDiscovered.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final int fetchAttempts;
        public final int pagesRecorded;
        public final int pagesFailed;
        public final long linksDiscovered;
        public Snapshot(int f, int r, int x, long l) {
            this.fetchAttempts = f;
            this.pagesRecorded = r;
            this.pagesFailed = x;
            this.linksDiscovered = l;
        }
    }
}
