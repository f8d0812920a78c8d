package com.doccrawler.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Objects;

/**
 * 전송 계층 응답.
 * finalUri 는 상대 링크 해석 기준. 리다이렉트 응답이면 Location 이 가리키는 주소(본문 없음).
 */
public record FetchedPage(URI requestedUri, URI finalUri, int status, String contentType, byte[] body) {

    public FetchedPage {
        Objects.requireNonNull(requestedUri, "requestedUri");
        if (finalUri == null) finalUri = requestedUri;
        if (body == null) body = new byte[0];
    }

    public static FetchedPage redirect(URI requestedUri, int status, URI location) {
        return new FetchedPage(requestedUri, Objects.requireNonNull(location, "location"), status, null, null);
    }

    public boolean isRedirect() {
        return status >= 300 && status < 400;
    }

    /** Content-Type 이 없으면 HTML 로 간주(문서 사이트 정적 호스팅에서 흔함) */
    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.startsWith("text/html") || ct.startsWith("application/xhtml+xml");
    }

    /** Content-Type 의 charset 파라미터. 없거나 알 수 없으면 null(본문에서 감지) */
    public Charset charset() {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring("charset=".length()).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
