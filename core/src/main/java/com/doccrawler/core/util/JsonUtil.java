package com.doccrawler.core.util;

/** 구조화 로그/크롤 리포트가 함께 쓰는 최소 JSON 문자열 유틸. */
public final class JsonUtil {
    private JsonUtil() {}

    /** 따옴표 포함 JSON 문자열. null 이면 리터럴 null */
    public static String esc(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 16);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /** "key":value. 숫자/불리언은 그대로, 나머지는 문자열 */
    public static String kv(String k, Object v) {
        return esc(k) + ":" + value(v);
    }

    public static String value(Object v) {
        if (v == null) return "null";
        if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
        return esc(String.valueOf(v));
    }
}
