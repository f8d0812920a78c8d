package com.doccrawler.core.error;

/** 텍스트를 출력 문서 형식으로 바꾸지 못함. 호출자는 원문을 그대로 쓴다 */
public class ConversionException extends Exception {
    public ConversionException(String message) { super(message); }
}
