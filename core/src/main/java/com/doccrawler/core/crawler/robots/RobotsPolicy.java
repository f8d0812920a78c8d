package com.doccrawler.core.crawler.robots;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 한 크롤 동안 고정되는 robots 정책.
 * - 그룹 전체를 보관하고 판정 시 UA 로 그룹을 고른다
 * - 지연은 선택된 그룹의 Crawl-delay → Request-rate 순서로만 본다(다른 그룹에서 빌려오지 않음)
 */
public final class RobotsPolicy {

    private final RobotsParser.ParsedRobots parsed; // allowAll 이면 null
    private final Instant fetchedAt;

    private RobotsPolicy(RobotsParser.ParsedRobots parsed, Instant fetchedAt) {
        this.parsed = parsed;
        this.fetchedAt = fetchedAt;
    }

    public static RobotsPolicy parse(String robotsTxt, Instant fetchedAt) {
        return new RobotsPolicy(RobotsParser.parse(robotsTxt == null ? "" : robotsTxt), fetchedAt);
    }

    /** 실패/없음 시 전체 허용 정책 */
    public static RobotsPolicy allowAll(Instant fetchedAt) {
        return new RobotsPolicy(null, fetchedAt);
    }

    public boolean allow(URI url, String userAgent) {
        if (parsed == null) return true;
        return RobotsMatcher.isAllowed(url, parsed.selectFor(userAgent));
    }

    /** 선언된 지연(Crawl-delay 우선, 다음 Request-rate). 선언 없으면 empty */
    public Optional<Duration> declaredDelay(String userAgent) {
        if (parsed == null) return Optional.empty();
        RobotsRules rules = parsed.selectFor(userAgent);
        if (rules.crawlDelay() != null) return Optional.of(rules.crawlDelay());
        return Optional.ofNullable(rules.requestRate());
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }
}
