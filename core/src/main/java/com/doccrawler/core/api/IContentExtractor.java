package com.doccrawler.core.api;

import com.doccrawler.core.error.ExtractionException;
import com.doccrawler.core.model.FetchedPage;

/** 응답 본문 → 본문 텍스트. 빈 문자열은 "추출 결과 없음"으로 취급된다 */
public interface IContentExtractor {
    String extractText(FetchedPage page) throws ExtractionException;
}
