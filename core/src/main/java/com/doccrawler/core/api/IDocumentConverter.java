package com.doccrawler.core.api;

import com.doccrawler.core.error.ConversionException;

/** 추출 텍스트 → 출력 문서 형식 */
@FunctionalInterface
public interface IDocumentConverter {
    String convert(String text) throws ConversionException;
}
