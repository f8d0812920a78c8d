package com.doccrawler.core.crawler;

import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.CrawlScope;
import com.doccrawler.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * URL 적격성 판정(순수 함수). 모두 만족해야 범위 안:
 * 1) scheme http/https, host + 포트가 기준 도메인과 정확히 일치(서브도메인 불가)
 * 2) 경로가 페이지 접미사(.html) 또는 '/' 로 끝남
 * 3) 경로에 예약 세그먼트(/_sources/, /_static/)가 없음
 * 4) (선택) 경로가 basePath 로 시작
 */
public final class ScopePolicy {

    private final CrawlScope scope;
    private final String pageSuffix;
    private final List<String> excludedSegments;
    private final boolean stayUnderBasePath;

    public ScopePolicy(CrawlScope scope, String pageSuffix, List<String> excludedSegments, boolean stayUnderBasePath) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.pageSuffix = Objects.requireNonNull(pageSuffix, "pageSuffix").toLowerCase(Locale.ROOT);
        this.excludedSegments = List.copyOf(Objects.requireNonNull(excludedSegments, "excludedSegments"));
        this.stayUnderBasePath = stayUnderBasePath;
    }

    public static ScopePolicy from(CrawlConfig cfg, CrawlScope scope) {
        return new ScopePolicy(scope, cfg.getPageSuffix(), cfg.getExcludedSegments(), cfg.isStayUnderBasePath());
    }

    public boolean isInScope(URI url) {
        return isSameSite(url) && isPagePath(url.getPath());
    }

    /** 규칙 1 만. 시드는 접미사 규칙을 면제받으므로 따로 쓴다 */
    public boolean isSameSite(URI url) {
        if (url == null || !UrlUtils.isHttp(url) || url.getHost() == null) return false;
        if (!scope.host().equals(url.getHost().toLowerCase(Locale.ROOT))) return false;
        return UrlUtils.effectivePort(url) == UrlUtils.effectivePort(scope.baseUri());
    }

    boolean isPagePath(String rawPath) {
        String path = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath;
        String lower = path.toLowerCase(Locale.ROOT);
        if (!(lower.endsWith(pageSuffix) || path.endsWith("/"))) return false;
        for (String seg : excludedSegments) {
            if (!seg.isEmpty() && path.contains(seg)) return false;
        }
        return !stayUnderBasePath || path.startsWith(scope.basePath());
    }

    public CrawlScope scope() {
        return scope;
    }
}
