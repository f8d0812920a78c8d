package com.doccrawler.core.error;

/** 응답 본문에서 텍스트를 뽑지 못함 */
public class ExtractionException extends Exception {
    public ExtractionException(String message) { super(message); }
    public ExtractionException(String message, Throwable cause) { super(message, cause); }
}
