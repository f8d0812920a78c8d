package com.doccrawler.core.model;

import java.util.Locale;

/** 싱크 전략: 단일 집계 파일 또는 페이지별 파일 */
public enum OutputMode {
    AGGREGATE,
    PER_PAGE;

    /** "aggregate", "per-page", "per_page" (대소문자 무시) */
    public static OutputMode parse(String s) {
        if (s == null) throw new IllegalArgumentException("output mode is null");
        String v = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OutputMode m : values()) {
            if (m.name().equals(v)) return m;
        }
        throw new IllegalArgumentException("unknown output mode: " + s + " (use aggregate|per-page)");
    }
}
