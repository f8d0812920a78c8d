package com.doccrawler.core.sink;

import com.doccrawler.core.api.IContentSink;
import com.doccrawler.core.api.IDocumentConverter;
import com.doccrawler.core.model.CrawlConfig;

import java.time.Clock;

/** 출력 모드 → 싱크 구현 */
public final class ContentSinks {
    private ContentSinks() {}

    public static IContentSink create(CrawlConfig cfg, IDocumentConverter converter, Clock clock) {
        return switch (cfg.getOutputMode()) {
            case AGGREGATE -> new AggregateFileSink(cfg.getOutputDir().resolve(cfg.getOutputFileName()), converter, clock);
            case PER_PAGE -> new PerPageFileSink(cfg.getOutputDir(), cfg.getPageSuffix());
        };
    }
}
