package com.doccrawler.core.api;

import com.doccrawler.core.model.CrawlReport;

/** 크롤러 최소 계약: 한 번 실행하고 요약을 돌려준다. */
public interface ICrawler {
    CrawlReport crawl();
}
