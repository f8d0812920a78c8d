package com.doccrawler.core.crawler;

import com.doccrawler.core.model.FetchedPage;

import java.net.URI;
import java.util.Set;

/** 페이지에서 크롤 대상 절대 URL 을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * url 을 직접 받아와 링크를 추출한다.
     * 전송/파싱 실패는 로그를 남기고 빈 집합을 돌려준다.
     */
    Set<URI> extractLinks(URI url);

    /** 이미 받아온 응답에서 추출(같은 페이지를 두 번 받지 않기 위함). */
    Set<URI> extractLinks(FetchedPage page);
}
