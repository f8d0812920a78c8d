package com.doccrawler.core.service;

import com.doccrawler.core.api.IContentExtractor;
import com.doccrawler.core.api.IContentSink;
import com.doccrawler.core.api.IDocumentConverter;
import com.doccrawler.core.api.IPageFetcher;
import com.doccrawler.core.crawler.ScopePolicy;
import com.doccrawler.core.crawler.TraversalEngine;
import com.doccrawler.core.crawler.robots.HttpRobotsFetcher;
import com.doccrawler.core.crawler.robots.RobotsClock;
import com.doccrawler.core.crawler.robots.RobotsFetcher;
import com.doccrawler.core.crawler.robots.RobotsGate;
import com.doccrawler.core.extract.JsoupContentExtractor;
import com.doccrawler.core.extract.MarkdownConverter;
import com.doccrawler.core.http.HttpPageFetcher;
import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.CrawlReport;
import com.doccrawler.core.model.CrawlScope;
import com.doccrawler.core.sink.ContentSinks;
import com.doccrawler.core.util.DefaultSleeper;
import com.doccrawler.core.util.ProgressListener;
import com.doccrawler.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.time.Clock;
import java.util.Objects;

/**
 * 크롤 오케스트레이터:
 *  - 출력 디렉터리 준비 → robots 로드 → 엔진 조립/실행 → crawl-report.json
 *  - 기본 구현체(HttpPageFetcher/JsoupContentExtractor/MarkdownConverter/HttpRobotsFetcher)
 *  - DI 생성자는 테스트용
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final IContentExtractor extractor;
    private final IDocumentConverter converter;
    private final RobotsFetcher robotsFetcher;
    private final Sleeper sleeper;
    private final Clock clock;
    private final CrawlReportWriter reportWriter = new CrawlReportWriter();

    /** 기본 구현 */
    public CrawlService(CrawlConfig config) {
        this(config,
                new HttpPageFetcher(config.getTimeout()),
                new JsoupContentExtractor(),
                new MarkdownConverter(),
                new HttpRobotsFetcher(config.getTimeout()),
                new DefaultSleeper(),
                Clock.systemDefaultZone());
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config, IPageFetcher fetcher, IContentExtractor extractor,
                        IDocumentConverter converter, RobotsFetcher robotsFetcher,
                        Sleeper sleeper, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.robotsFetcher = Objects.requireNonNull(robotsFetcher, "robotsFetcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CrawlReport run() throws IOException {
        return run(ProgressListener.NONE);
    }

    /**
     * 크롤 1회 실행.
     *
     * @throws IOException 출력 디렉터리를 만들 수 없을 때(페이지 단위 실패는 예외가 아님)
     */
    public CrawlReport run(ProgressListener listener) throws IOException {
        Files.createDirectories(config.getOutputDir());

        URI seed = config.seedUri();
        CrawlScope scope = CrawlScope.of(seed);
        ScopePolicy policy = ScopePolicy.from(config, scope);

        RobotsGate robots = config.isRespectRobots()
                ? RobotsGate.load(scope.baseUri(), config.getUserAgent(), robotsFetcher,
                        RobotsClock.SYSTEM, config.getDefaultDelay())
                : RobotsGate.allowAll(config.getDefaultDelay());
        if (!config.isRespectRobots()) {
            LOG.warn("robots.txt is ignored for this crawl (respectRobots=false)");
        }

        CrawlReport report;
        try (IContentSink sink = ContentSinks.create(config, converter, clock)) {
            TraversalEngine engine = TraversalEngine.builder()
                    .config(config)
                    .scope(policy)
                    .robots(robots)
                    .fetcher(fetcher)
                    .extractor(extractor)
                    .sink(sink)
                    .sleeper(sleeper)
                    .listener(listener)
                    .build();
            report = engine.crawl();
        }

        try {
            var out = reportWriter.write(report, config.getOutputDir());
            LOG.info("Crawl report written: {}", out);
        } catch (IOException e) {
            LOG.warn("Could not write {}: {}", CrawlReportWriter.FILE_NAME, e.toString());
        }
        return report;
    }

    public CrawlConfig config() {
        return config;
    }
}
