package com.doccrawler.core.crawler;

import com.doccrawler.core.api.ICrawler;
import com.doccrawler.core.api.IContentExtractor;
import com.doccrawler.core.api.IContentSink;
import com.doccrawler.core.api.IPageFetcher;
import com.doccrawler.core.crawler.robots.RobotsGate;
import com.doccrawler.core.error.ExtractionException;
import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.CrawlReport;
import com.doccrawler.core.model.CrawlStats;
import com.doccrawler.core.model.FetchedPage;
import com.doccrawler.core.model.PageResult;
import com.doccrawler.core.model.TraversalOrder;
import com.doccrawler.core.util.DefaultSleeper;
import com.doccrawler.core.util.ProgressListener;
import com.doccrawler.core.util.Sleeper;
import com.doccrawler.core.util.StructuredLog;
import com.doccrawler.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 작업 목록(worklist) 기반 순회 엔진.
 * - DEPTH_FIRST: 스택. 링크를 문서 역순으로 쌓아 재귀 전위 순회와 같은 방문 순서
 * - BREADTH_FIRST: 큐
 * - 꺼낼 때 방문/예산 확인 → VISITING 표시 → 지연 → 받기/추출/기록/링크 발견
 * - 리다이렉트 응답은 기록하지 않고, 이동할 주소를 발견한 링크처럼 작업 목록에 넣는다
 * - 페이지 단위 실패는 PageStepGuard 가 흡수하고 크롤은 계속된다
 *
 * 엔진 인스턴스 하나가 방문 집합과 통계를 소유한다. crawl() 은 한 번만 호출한다.
 */
public final class TraversalEngine implements ICrawler {
    private static final Logger log = LoggerFactory.getLogger(TraversalEngine.class);
    private static final StructuredLog slog = StructuredLog.get(TraversalEngine.class);

    private final CrawlConfig config;
    private final ScopePolicy scope;
    private final RobotsGate robots;
    private final IPageFetcher fetcher;
    private final IContentExtractor extractor;
    private final IContentSink sink;
    private final LinkExtractor links;
    private final Sleeper sleeper;
    private final ProgressListener listener;

    private final VisitedSet visited = new VisitedSet();
    private final CrawlStats stats = new CrawlStats();
    private final PageStepGuard guard = new PageStepGuard();

    private TraversalEngine(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.scope = Objects.requireNonNull(b.scope, "scope");
        this.robots = Objects.requireNonNull(b.robots, "robots");
        this.fetcher = Objects.requireNonNull(b.fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(b.extractor, "extractor");
        this.sink = Objects.requireNonNull(b.sink, "sink");
        this.links = (b.links != null) ? b.links
                : new JsoupLinkExtractor(fetcher, config.getUserAgent(), scope, robots);
        this.sleeper = (b.sleeper != null) ? b.sleeper : new DefaultSleeper();
        this.listener = (b.listener != null) ? b.listener : ProgressListener.NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CrawlReport crawl() {
        Instant startedAt = Instant.now();
        long t0 = System.nanoTime();
        String ua = config.getUserAgent();
        URI seed = config.seedUri();
        Duration delay = robots.minDelay();
        int budget = config.hasPageBudget() ? config.getMaxPages() : -1;
        boolean interrupted = false;

        slog.info("crawl-start", "seed", seed.toString(), "maxPages", budget,
                "delayMs", delay.toMillis(), "robotsFallback", robots.isFallback(),
                "order", config.getTraversalOrder().name());
        log.info("Crawl start: {} (maxPages={}, delay={}ms, order={})",
                seed, budget < 0 ? "unlimited" : budget, delay.toMillis(), config.getTraversalOrder());

        Deque<URI> frontier = new ArrayDeque<>();
        if (!scope.isSameSite(seed)) {
            log.warn("Seed {} is outside the crawl scope; nothing to do", seed);
        } else if (!robots.canFetch(ua, seed)) {
            log.warn("Seed {} is disallowed by robots.txt for {}; nothing to do", seed, ua);
        } else {
            frontier.add(seed);
        }

        while (!frontier.isEmpty()) {
            if (budgetReached()) {
                log.info("Page budget of {} reached; stopping with {} URL(s) left in the frontier",
                        config.getMaxPages(), frontier.size());
                break;
            }
            URI url = frontier.pollFirst();
            if (!visited.tryBegin(url)) continue;

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                visited.markFailed(url);
                interrupted = true;
                log.warn("Crawl interrupted while waiting before {}", url);
                break;
            }

            PageResult result = visit(url);
            schedule(frontier, result.links());
            listener.onPage(visited.size(), budget, url, result.succeeded());

            if (Thread.currentThread().isInterrupted()) {
                interrupted = true;
                log.warn("Crawl interrupted after {}", url);
                break;
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        CrawlStats.Snapshot snap = stats.snapshot();
        slog.info("crawl-done", "visited", visited.size(), "recorded", snap.pagesRecorded,
                "failed", snap.pagesFailed, "links", snap.linksDiscovered,
                "elapsedMs", elapsed.toMillis(), "interrupted", interrupted);
        log.info("Crawl done: visited={}, recorded={}, failed={} in {}ms",
                visited.size(), snap.pagesRecorded, snap.pagesFailed, elapsed.toMillis());

        return new CrawlReport(seed, startedAt, elapsed, config.getMaxPages(), delay,
                robots.isFallback(), snap, visited.urls(), sink.location(), interrupted);
    }

    /** 한 URL 처리. 실패해도 예외를 내보내지 않는다 */
    private PageResult visit(URI url) {
        stats.fetchAttempted();
        String ua = config.getUserAgent();

        Optional<FetchedPage> page = guard.attempt(url, "fetch", () -> fetcher.fetch(url, ua));
        if (page.isEmpty()) return fail(url, "fetch");

        FetchedPage p = page.get();
        if (p.isRedirect()) return redirected(url, p);

        Optional<String> text = guard.attempt(url, "extract", () -> {
            String t = extractor.extractText(p);
            if (t == null || t.isBlank()) throw new ExtractionException("no text extracted from " + url);
            return t;
        });
        if (text.isEmpty()) return fail(url, "extract");

        Optional<Boolean> recorded = guard.attempt(url, "record", () -> {
            sink.record(url, text.get());
            return Boolean.TRUE;
        });
        if (recorded.isEmpty()) return fail(url, "record");

        stats.pageRecorded();
        visited.markCompleted(url);
        slog.info("page-recorded", "url", url.toString(), "chars", text.get().length());

        Set<URI> found = guard.attempt(url, "links", () -> links.extractLinks(p)).orElse(Set.of());
        stats.linksDiscovered(found.size());
        log.debug("{} -> {} in-scope link(s)", url, found.size());
        return new PageResult(url, text.get(), found);
    }

    /** 이동할 주소는 발견한 링크와 같은 경로(범위/robots/방문 확인, 지연)로만 받는다 */
    private PageResult redirected(URI url, FetchedPage p) {
        URI target = UrlUtils.normalize(p.finalUri());
        visited.markCompleted(url);
        slog.info("page-redirected", "url", url.toString(), "status", p.status(), "to", target.toString());
        if (!scope.isInScope(target) || !robots.canFetch(config.getUserAgent(), target)) {
            log.info("{} redirects to {} which is out of scope or disallowed; dropped", url, target);
            return PageResult.redirected(url, null);
        }
        log.debug("{} redirects to {}", url, target);
        return PageResult.redirected(url, target);
    }

    private PageResult fail(URI url, String step) {
        stats.pageFailed();
        visited.markFailed(url);
        slog.warn("page-failed", "url", url.toString(), "step", step);
        return PageResult.failed(url);
    }

    private void schedule(Deque<URI> frontier, Set<URI> found) {
        if (found.isEmpty()) return;
        String ua = config.getUserAgent();
        List<URI> accepted = new ArrayList<>(found.size());
        for (URI u : found) {
            // 범위/robots 는 LinkExtractor 구현과 무관하게 여기서도 확인
            if (visited.contains(u) || !scope.isInScope(u) || !robots.canFetch(ua, u)) continue;
            accepted.add(u);
        }
        if (config.getTraversalOrder() == TraversalOrder.BREADTH_FIRST) {
            accepted.forEach(frontier::addLast);
        } else {
            for (int i = accepted.size() - 1; i >= 0; i--) frontier.addFirst(accepted.get(i));
        }
    }

    private boolean budgetReached() {
        return config.hasPageBudget() && visited.size() >= config.getMaxPages();
    }

    /** 테스트/리포트용 */
    public VisitedSet visited() {
        return visited;
    }

    public static final class Builder {
        private CrawlConfig config;
        private ScopePolicy scope;
        private RobotsGate robots;
        private IPageFetcher fetcher;
        private IContentExtractor extractor;
        private IContentSink sink;
        private LinkExtractor links;
        private Sleeper sleeper;
        private ProgressListener listener;

        private Builder() {}

        public Builder config(CrawlConfig v) { this.config = v; return this; }
        public Builder scope(ScopePolicy v) { this.scope = v; return this; }
        public Builder robots(RobotsGate v) { this.robots = v; return this; }
        public Builder fetcher(IPageFetcher v) { this.fetcher = v; return this; }
        public Builder extractor(IContentExtractor v) { this.extractor = v; return this; }
        public Builder sink(IContentSink v) { this.sink = v; return this; }
        public Builder linkExtractor(LinkExtractor v) { this.links = v; return this; }
        public Builder sleeper(Sleeper v) { this.sleeper = v; return this; }
        public Builder listener(ProgressListener v) { this.listener = v; return this; }

        public TraversalEngine build() {
            return new TraversalEngine(this);
        }
    }
}
