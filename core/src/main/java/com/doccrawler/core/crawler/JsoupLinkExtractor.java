package com.doccrawler.core.crawler;

import com.doccrawler.core.api.IPageFetcher;
import com.doccrawler.core.crawler.robots.RobotsGate;
import com.doccrawler.core.error.FetchException;
import com.doccrawler.core.extract.HtmlDocuments;
import com.doccrawler.core.model.FetchedPage;
import com.doccrawler.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** JSoup 기반 링크 추출기: a[href] → abs:href → 정규화 → 범위/robots 필터. 문서 순서 유지 */
public class JsoupLinkExtractor implements LinkExtractor {
    private static final Logger log = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    private final IPageFetcher fetcher;
    private final String userAgent;
    private final ScopePolicy scope;
    private final RobotsGate robots;

    public JsoupLinkExtractor(IPageFetcher fetcher, String userAgent, ScopePolicy scope, RobotsGate robots) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.robots = Objects.requireNonNull(robots, "robots");
    }

    @Override
    public Set<URI> extractLinks(URI url) {
        if (url == null) return Collections.emptySet();
        try {
            return extractLinks(fetcher.fetch(url, userAgent));
        } catch (FetchException e) {
            log.warn("link extraction skipped for {}: {}", url, e.getMessage());
            return Collections.emptySet();
        }
    }

    @Override
    public Set<URI> extractLinks(FetchedPage page) {
        Set<URI> out = new LinkedHashSet<>();
        if (page == null || !page.isHtml()) return out;

        Document doc;
        try {
            doc = HtmlDocuments.parse(page);
        } catch (IOException e) {
            log.warn("link extraction skipped for {}: {}", page.requestedUri(), e.getMessage());
            return out;
        }

        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            URI u = UrlUtils.parse(abs);
            if (u == null || !UrlUtils.isHttp(u)) continue;   // 잘못된 URL, mailto: 등
            URI n = UrlUtils.normalize(u);
            if (!scope.isInScope(n)) continue;
            if (!robots.canFetch(userAgent, n)) continue;
            out.add(n);
        }
        return out;
    }
}
