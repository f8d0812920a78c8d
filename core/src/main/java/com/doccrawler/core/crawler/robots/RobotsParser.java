package com.doccrawler.core.crawler.robots;

import java.time.Duration;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RobotsParser
 * - 지원 지시어: User-agent / Allow / Disallow / Crawl-delay / Request-rate (키 대소문자 무시)
 * - 연속된 User-agent 라인은 "같은 그룹"으로 취급, 그 뒤 지시어 누적
 * - UA 저장: 소문자
 * - UA 선택: 그룹 토큰이 크롤러 제품 토큰("DocCrawler/1.0" → "doccrawler")에 포함되면 그 그룹, 없으면 "*" 그룹
 * - 규칙 값: 빈 값은 무시, 퍼센트 HEX 대문자 정규화만 수행
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    private static final Pattern RATE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*/\\s*(\\d+(?:\\.\\d+)?)\\s*([smhd]?)$");
    static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";

        List<Group> groups = new ArrayList<>();
        RobotsRules star = null;

        Group current = null;
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            if (key.equals("user-agent")) {
                String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                if (!lastWasUA || current == null) {
                    current = new Group(new ArrayList<>(), new RobotsRules());
                    groups.add(current);
                }
                current.agents().add(ua);
                lastWasUA = true;
                continue;
            }

            lastWasUA = false;
            if (current == null) {
                // User-agent 없이 시작한 규칙은 "*" 그룹 소속
                current = new Group(new ArrayList<>(List.of(UA_ALL)), new RobotsRules());
                groups.add(current);
            }
            RobotsRules rules = current.rules();
            switch (key) {
                case "allow" -> {
                    if (!val.isEmpty()) rules.addAllow(RobotsMatcher.normalizeRule(val));
                }
                case "disallow" -> {
                    if (!val.isEmpty()) rules.addDisallow(RobotsMatcher.normalizeRule(val));
                }
                case "crawl-delay" -> rules.crawlDelay(parseDelay(val));
                case "request-rate" -> rules.requestRate(parseRequestRate(val));
                default -> {
                    // 기타 지시어(Sitemap, Host 등) 무시
                }
            }
        }

        List<Group> named = new ArrayList<>();
        for (Group g : groups) {
            if (g.agents().contains(UA_ALL)) {
                // "*" 는 첫 그룹만 유효
                if (star == null) star = g.rules();
            } else {
                named.add(g);
            }
        }
        return new ParsedRobots(named, star != null ? star : new RobotsRules());
    }

    /** "2", "0.5" → Duration. 음수/0/숫자 아님 → null(선언 없음 취급) */
    static Duration parseDelay(String val) {
        try {
            double seconds = Double.parseDouble(val);
            if (Double.isNaN(seconds) || Double.isInfinite(seconds) || seconds <= 0) return null;
            return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** "requests/seconds" (선택적 단위 s/m/h/d) → 요청당 간격. 잘못된 값은 null */
    static Duration parseRequestRate(String val) {
        Matcher m = RATE.matcher(val.toLowerCase(Locale.ROOT));
        if (!m.matches()) return null;
        double requests = Double.parseDouble(m.group(1));
        double period = Double.parseDouble(m.group(2));
        switch (m.group(3)) {
            case "m" -> period *= 60;
            case "h" -> period *= 3600;
            case "d" -> period *= 86400;
            default -> { }
        }
        if (requests <= 0 || period <= 0) return null;
        return Duration.ofNanos(Math.round(period / requests * 1_000_000_000d));
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** User-agent 토큰 묶음 + 규칙 */
    public record Group(List<String> agents, RobotsRules rules) {

        /** 그룹 토큰이 제품 토큰에 포함되면 적용 */
        boolean appliesTo(String productToken) {
            for (String a : agents) {
                if (!a.isEmpty() && productToken.contains(a)) return true;
            }
            return false;
        }
    }

    /** UA 선택 포함 결과 */
    public record ParsedRobots(List<Group> groups, RobotsRules star) {

        /** 문서 순서상 처음 적용되는 그룹, 없으면 "*" 그룹 */
        public RobotsRules selectFor(String userAgent) {
            String token = productToken(userAgent);
            if (!token.isEmpty()) {
                for (Group g : groups) {
                    if (g.appliesTo(token)) return g.rules();
                }
            }
            return star;
        }
    }

    /** "DocCrawler/1.0 (+https://…)" → "doccrawler" */
    static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String s = userAgent.trim();
        int slash = s.indexOf('/');
        if (slash >= 0) s = s.substring(0, slash);
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
