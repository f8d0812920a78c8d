package com.doccrawler.core.model;

import java.net.URI;
import java.util.Set;

/** 한 번의 순회 단계에서 만들어지고 소비되는 결과. text 가 null 이면 기록 안 됨(실패 또는 리다이렉트) */
public record PageResult(URI source, String text, Set<URI> links) {

    public PageResult {
        links = (links == null) ? Set.of() : links;
    }

    public static PageResult failed(URI source) {
        return new PageResult(source, null, Set.of());
    }

    /** target 이 null 이면 따라갈 곳 없음 */
    public static PageResult redirected(URI source, URI target) {
        return new PageResult(source, null, target == null ? Set.of() : Set.of(target));
    }

    public boolean succeeded() {
        return text != null;
    }
}
