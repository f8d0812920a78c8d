package com.doccrawler.core.crawler.robots;

import com.doccrawler.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 시작 시 robots.txt 를 한 번만 읽고, 이후 허용 판정과 최소 지연을 제공한다.
 * 로드 실패(네트워크 오류, 2xx 아님, 크로스-호스트 리다이렉트, 리다이렉트 초과)는
 * 전체 허용 + 기본 지연으로 진행한다(fail-open).
 */
public final class RobotsGate {
    private static final Logger log = LoggerFactory.getLogger(RobotsGate.class);

    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);
    static final int MAX_REDIRECTS = 3;

    private final RobotsPolicy policy;
    private final Duration minDelay;
    private final boolean fallback;

    private RobotsGate(RobotsPolicy policy, Duration minDelay, boolean fallback) {
        this.policy = policy;
        this.minDelay = minDelay;
        this.fallback = fallback;
    }

    public static RobotsGate load(URI baseUrl, String userAgent, RobotsFetcher fetcher, RobotsClock clock) {
        return load(baseUrl, userAgent, fetcher, clock, DEFAULT_DELAY);
    }

    public static RobotsGate load(URI baseUrl, String userAgent, RobotsFetcher fetcher,
                                  RobotsClock clock, Duration defaultDelay) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(clock, "clock");
        Duration fallbackDelay = defaultDelay == null ? DEFAULT_DELAY : defaultDelay;
        Instant now = Instant.ofEpochMilli(clock.nowMillis());

        URI robots = robotsTxtUri(baseUrl);
        if (robots == null) {
            log.warn("robots.txt unavailable: base URL {} has no http(s) host; allowing all", baseUrl);
            return new RobotsGate(RobotsPolicy.allowAll(now), fallbackDelay, true);
        }

        URI cur = robots;
        for (int hop = 0; hop <= MAX_REDIRECTS; hop++) {
            RobotsFetcher.Response r = fetcher.fetch(cur, userAgent);
            int s = r.status;

            if (s == 0) {
                return failOpen(robots, "network error: " + r.error.orElse("unknown"), now, fallbackDelay);
            }
            if (s >= 200 && s < 300) {
                RobotsPolicy policy;
                try {
                    policy = RobotsPolicy.parse(r.body, now);
                } catch (RuntimeException e) {
                    return failOpen(robots, "parse error: " + e, now, fallbackDelay);
                }
                Duration delay = policy.declaredDelay(userAgent).orElse(fallbackDelay);
                log.info("robots.txt loaded from {} (minDelay={}ms)", cur, delay.toMillis());
                return new RobotsGate(policy, delay, false);
            }
            if (isRedirect(s) && r.finalUri != null) {
                URI next = r.finalUri;
                if (!sameHost(cur, next)) {
                    return failOpen(robots, "cross-host redirect to " + next, now, fallbackDelay);
                }
                cur = next;
                continue;
            }
            return failOpen(robots, "HTTP " + s, now, fallbackDelay);
        }
        return failOpen(robots, "too many redirects", now, fallbackDelay);
    }

    /** robots 를 무시하는 설정(respectRobots=false)용 */
    public static RobotsGate allowAll(Duration delay) {
        return new RobotsGate(RobotsPolicy.allowAll(Instant.now()),
                delay == null ? DEFAULT_DELAY : delay, true);
    }

    public boolean canFetch(String userAgent, URI url) {
        return policy.allow(url, userAgent);
    }

    public Duration minDelay() {
        return minDelay;
    }

    /** 전체 허용 폴백으로 동작 중인지 */
    public boolean isFallback() {
        return fallback;
    }

    public Instant fetchedAt() {
        return policy.fetchedAt();
    }

    private static RobotsGate failOpen(URI robots, String reason, Instant now, Duration delay) {
        log.warn("robots.txt at {} could not be used ({}); allowing all with {}ms delay",
                robots, reason, delay.toMillis());
        return new RobotsGate(RobotsPolicy.allowAll(now), delay, true);
    }

    private static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 303 || s == 307 || s == 308;
    }

    /** 스킴 전환(http→https)은 허용: 호스트만 본다 */
    private static boolean sameHost(URI a, URI b) {
        return a.getHost() != null && a.getHost().equalsIgnoreCase(b.getHost());
    }

    static URI robotsTxtUri(URI page) {
        if (!UrlUtils.isHttp(page)) return null;
        String host = page.getHost();
        if (host == null || host.isEmpty()) return null;
        int port = page.getPort();
        String authority = (port < 0) ? host : host + ":" + port;
        return URI.create(page.getScheme().toLowerCase(Locale.ROOT) + "://" + authority + "/robots.txt");
    }
}
