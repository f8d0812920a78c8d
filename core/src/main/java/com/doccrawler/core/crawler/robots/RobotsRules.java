package com.doccrawler.core.crawler.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** 한 User-agent 그룹의 규칙 + 지연 지시어 */
public final class RobotsRules {
    public final List<String> allow = new ArrayList<>();
    public final List<String> disallow = new ArrayList<>();
    private Duration crawlDelay;     // Crawl-delay (없으면 null)
    private Duration requestRate;    // Request-rate 를 요청당 간격으로 환산 (없으면 null)

    public RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    public RobotsRules addDisallow(String path) {
        // Disallow: (빈값) 은 규칙으로 취급하지 않음
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }

    public RobotsRules crawlDelay(Duration d)  { this.crawlDelay = d; return this; }
    public RobotsRules requestRate(Duration d) { this.requestRate = d; return this; }

    public Duration crawlDelay()  { return crawlDelay; }
    public Duration requestRate() { return requestRate; }

    public boolean isEmpty() {
        return allow.isEmpty() && disallow.isEmpty() && crawlDelay == null && requestRate == null;
    }
}
