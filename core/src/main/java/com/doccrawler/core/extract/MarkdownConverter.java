package com.doccrawler.core.extract;

import com.doccrawler.core.api.IDocumentConverter;
import com.doccrawler.core.error.ConversionException;

import java.util.regex.Pattern;

/**
 * 추출 텍스트 → Markdown 본문.
 * 줄바꿈 통일, 줄 끝 공백 제거, 연속 빈 줄 축소, 레코드 구분자와 겹치는 "---" 줄은 "***" 로.
 * 빈 입력/바이너리(제어문자) 입력은 ConversionException → 싱크가 원문으로 대체한다.
 */
public final class MarkdownConverter implements IDocumentConverter {

    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern RULE_LINE = Pattern.compile("(?m)^[ \\t]*-{3,}[ \\t]*$");
    private static final Pattern TRAILING_WS = Pattern.compile("(?m)[ \\t]+$");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n{3,}");

    @Override
    public String convert(String text) throws ConversionException {
        if (text == null || text.isBlank()) throw new ConversionException("empty input");
        if (CONTROL.matcher(text).find()) throw new ConversionException("input contains control characters");

        String s = text.replace("\r\n", "\n").replace('\r', '\n');
        s = TRAILING_WS.matcher(s).replaceAll("");
        s = RULE_LINE.matcher(s).replaceAll("***");
        s = BLANK_RUN.matcher(s).replaceAll("\n\n");
        return s.strip();
    }
}
