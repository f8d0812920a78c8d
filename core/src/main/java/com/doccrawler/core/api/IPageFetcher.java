package com.doccrawler.core.api;

import com.doccrawler.core.error.FetchException;
import com.doccrawler.core.model.FetchedPage;

import java.net.URI;

/** 원시 HTTP 전송 계약: URL + User-Agent → 응답 바이트 또는 실패 */
public interface IPageFetcher {
    FetchedPage fetch(URI url, String userAgent) throws FetchException;
}
