package com.doccrawler.core.model;

import java.util.Locale;

public enum TraversalOrder {
    /** 스택: 페이지가 먼저 나열한 링크부터 끝까지 파고든다(기본) */
    DEPTH_FIRST,
    /** 큐: 얕은 페이지부터 */
    BREADTH_FIRST;

    public static TraversalOrder parse(String s) {
        if (s == null) throw new IllegalArgumentException("traversal order is null");
        String v = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (TraversalOrder o : values()) {
            if (o.name().equals(v)) return o;
        }
        throw new IllegalArgumentException("unknown traversal order: " + s);
    }
}
