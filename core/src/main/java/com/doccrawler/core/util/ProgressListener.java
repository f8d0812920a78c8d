package com.doccrawler.core.util;

import java.net.URI;

@FunctionalInterface
public interface ProgressListener {
    /**
     * 페이지 하나의 처리가 끝날 때마다 호출된다.
     *
     * @param visited  지금까지 방문(시도)한 페이지 수
     * @param budget   페이지 예산(무제한이면 -1)
     * @param url      방금 처리한 URL
     * @param recorded 싱크 기록 성공 여부
     */
    void onPage(int visited, int budget, URI url, boolean recorded);

    ProgressListener NONE = (v, b, u, r) -> {};
}
