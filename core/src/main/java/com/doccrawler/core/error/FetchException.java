package com.doccrawler.core.error;

import java.io.IOException;
import java.net.URI;

/** 페이지 전송 실패. status 는 HTTP 상태코드, 네트워크 오류면 -1 */
public class FetchException extends IOException {
    private final URI url;
    private final int status;

    public FetchException(URI url, int status, String message) {
        super(message);
        this.url = url;
        this.status = status;
    }

    public FetchException(URI url, int status, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = status;
    }

    public URI getUrl() { return url; }
    public int getStatus() { return status; }
}
