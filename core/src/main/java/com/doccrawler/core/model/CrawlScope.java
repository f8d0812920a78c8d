package com.doccrawler.core.model;

import com.doccrawler.core.util.UrlUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 범위: 기준 도메인(scheme + host[:port]) 과 기준 경로.
 * 시드 URL 에서 한 번 만들어지고 크롤 동안 바뀌지 않는다.
 */
public record CrawlScope(String scheme, String host, int port, String basePath) {

    public CrawlScope {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) throw new IllegalArgumentException("seed URL has no host");
        scheme = scheme.toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);
        basePath = (basePath == null || basePath.isEmpty()) ? "/" : basePath;
    }

    public static CrawlScope of(URI seed) {
        URI n = UrlUtils.normalize(Objects.requireNonNull(seed, "seed"));
        if (!UrlUtils.isHttp(n) || n.getHost() == null) {
            throw new IllegalArgumentException("seed must be an absolute http(s) URL: " + seed);
        }
        return new CrawlScope(n.getScheme(), n.getHost(), n.getPort(), UrlUtils.directoryOf(n.getPath()));
    }

    /** "https://docs.example.org" 형태 */
    public String baseDomain() {
        return scheme + "://" + host + (port < 0 ? "" : ":" + port);
    }

    public URI baseUri() {
        return URI.create(baseDomain() + "/");
    }

    /** 경로 첫 세그먼트(예: /ja/3/ → "ja"). 없으면 빈 문자열 */
    public String libraryName() {
        String p = basePath.replaceAll("^/+", "");
        int i = p.indexOf('/');
        return i < 0 ? p : p.substring(0, i);
    }
}
