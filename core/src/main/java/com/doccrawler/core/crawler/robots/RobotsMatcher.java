package com.doccrawler.core.crawler.robots;

import java.net.URI;
import java.util.Objects;

/**
 * robots 경로 규칙 판정.
 * 경로는 rawPath(쿼리 제외)를 쓰고 퍼센트 HEX 는 양쪽 모두 대문자로 맞춘다.
 * 가장 긴 규칙이 이기며('*' 와 끝의 '$' 는 길이에서 뺀다) 길이가 같으면 Allow.
 * '*' 는 임의 문자열, 끝의 '$' 는 경로 끝 고정, 나머지는 접두 일치("/doc" 는 "/docs.html" 에도 걸린다).
 */
public final class RobotsMatcher {
    private static final String HEX = "0123456789abcdefABCDEF";

    private RobotsMatcher() {}

    /** 걸리는 규칙이 없으면 허용 */
    public static boolean isAllowed(URI url, RobotsRules rules) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(rules, "rules");
        String raw = url.getRawPath();
        String path = upperHex(raw == null || raw.isEmpty() ? "/" : raw);

        int best = -1;
        boolean allowed = true;
        for (String rule : rules.disallow) {
            int len = effectiveLen(rule);
            if (len > best && matches(path, rule)) {
                best = len;
                allowed = false;
            }
        }
        for (String rule : rules.allow) {
            int len = effectiveLen(rule);
            if (len >= best && matches(path, rule)) {
                best = len;
                allowed = true;
            }
        }
        return allowed;
    }

    /** 파서가 규칙을 저장하기 전에 호출 */
    static String normalizeRule(String rule) {
        return rule == null ? "" : upperHex(rule.trim());
    }

    static int effectiveLen(String rule) {
        if (rule == null) return 0;
        String r = rule.trim();
        int end = r.endsWith("$") ? r.length() - 1 : r.length();
        int len = 0;
        for (int i = 0; i < end; i++) {
            if (r.charAt(i) != '*') len++;
        }
        return len;
    }

    static boolean matches(String path, String rule) {
        if (rule == null || rule.isBlank()) return false;
        String r = rule.trim();
        boolean anchored = r.endsWith("$");
        return glob(path, 0, anchored ? r.substring(0, r.length() - 1) : r, 0, anchored);
    }

    private static boolean glob(String s, int i, String p, int j, boolean anchored) {
        while (j < p.length()) {
            char c = p.charAt(j);
            if (c == '*') {
                while (j < p.length() && p.charAt(j) == '*') j++;
                if (j == p.length()) return true;
                for (int k = i; k <= s.length(); k++) {
                    if (glob(s, k, p, j, anchored)) return true;
                }
                return false;
            }
            if (i >= s.length() || s.charAt(i) != c) return false;
            i++;
            j++;
        }
        return !anchored || i == s.length();
    }

    static String upperHex(String s) {
        StringBuilder sb = new StringBuilder(s);
        for (int i = 0; i + 2 < sb.length(); i++) {
            if (sb.charAt(i) == '%' && HEX.indexOf(sb.charAt(i + 1)) >= 0 && HEX.indexOf(sb.charAt(i + 2)) >= 0) {
                sb.setCharAt(i + 1, Character.toUpperCase(sb.charAt(i + 1)));
                sb.setCharAt(i + 2, Character.toUpperCase(sb.charAt(i + 2)));
                i += 2;
            }
        }
        return sb.toString();
    }
}
