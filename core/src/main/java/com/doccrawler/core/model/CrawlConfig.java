package com.doccrawler.core.model;

import com.doccrawler.core.util.UrlUtils;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml / CLI 매핑 대상). 순수 설정 보관용.
 * 우선순위는 기본값 &lt; YAML &lt; CLI 이며, 병합은 호출자(app-cli)가 한다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_USER_AGENT = "DocCrawler/1.0";
    public static final String DEFAULT_OUTPUT_FILE = "crawled_content.md";
    public static final String DEFAULT_PAGE_SUFFIX = ".html";
    public static final List<String> DEFAULT_EXCLUDED_SEGMENTS = List.of("/_sources/", "/_static/");
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

    private String target;                       // 시드 URL (필수)
    private Integer maxPages;                    // null 이면 무제한
    private String userAgent = DEFAULT_USER_AGENT;
    private Duration timeout = Duration.ofSeconds(30);

    private Path outputDir = Path.of("output");
    private OutputMode outputMode = OutputMode.AGGREGATE;
    private String outputFileName = DEFAULT_OUTPUT_FILE;

    private String pageSuffix = DEFAULT_PAGE_SUFFIX;
    private List<String> excludedSegments = DEFAULT_EXCLUDED_SEGMENTS;
    private boolean stayUnderBasePath = false;

    private boolean respectRobots = true;
    private Duration defaultDelay = DEFAULT_DELAY;

    private TraversalOrder traversalOrder = TraversalOrder.DEPTH_FIRST;

    // ---------- getters ----------
    public String getTarget() { return target; }
    public Integer getMaxPages() { return maxPages; }
    public boolean hasPageBudget() { return maxPages != null; }
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public Path getOutputDir() { return outputDir; }
    public OutputMode getOutputMode() { return outputMode; }
    public String getOutputFileName() { return outputFileName; }
    public String getPageSuffix() { return pageSuffix; }
    public List<String> getExcludedSegments() { return excludedSegments; }
    public boolean isStayUnderBasePath() { return stayUnderBasePath; }
    public boolean isRespectRobots() { return respectRobots; }
    public Duration getDefaultDelay() { return defaultDelay; }
    public TraversalOrder getTraversalOrder() { return traversalOrder; }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxPages(Integer maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setOutputMode(OutputMode mode) { this.outputMode = (mode != null ? mode : OutputMode.AGGREGATE); return this; }
    public CrawlConfig setOutputFileName(String name) { this.outputFileName = name; return this; }
    public CrawlConfig setPageSuffix(String suffix) { this.pageSuffix = suffix; return this; }
    public CrawlConfig setExcludedSegments(List<String> segments) {
        if (segments != null) this.excludedSegments = List.copyOf(segments);
        return this;
    }
    public CrawlConfig setStayUnderBasePath(boolean v) { this.stayUnderBasePath = v; return this; }
    public CrawlConfig setRespectRobots(boolean v) { this.respectRobots = v; return this; }
    public CrawlConfig setDefaultDelay(Duration d) { this.defaultDelay = d; return this; }
    public CrawlConfig setTraversalOrder(TraversalOrder order) {
        this.traversalOrder = (order != null ? order : TraversalOrder.DEPTH_FIRST);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(target, "target");
        URI seed = UrlUtils.parse(target);
        if (seed == null || !UrlUtils.isHttp(seed) || seed.getHost() == null) {
            throw new IllegalArgumentException("target must be an absolute http(s) URL: " + target);
        }
        if (maxPages != null && maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent must not be blank");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");

        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(outputMode, "outputMode");
        if (outputFileName == null || outputFileName.isBlank()
                || outputFileName.contains("/") || outputFileName.contains("\\"))
            throw new IllegalArgumentException("outputFileName must be a plain file name");

        if (pageSuffix == null || pageSuffix.isBlank()) throw new IllegalArgumentException("pageSuffix must not be blank");
        Objects.requireNonNull(excludedSegments, "excludedSegments");
        if (defaultDelay == null || defaultDelay.isNegative())
            throw new IllegalArgumentException("defaultDelay must be >= 0");
        Objects.requireNonNull(traversalOrder, "traversalOrder");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public URI seedUri() {
        return UrlUtils.normalize(URI.create(target.trim()));
    }
}
