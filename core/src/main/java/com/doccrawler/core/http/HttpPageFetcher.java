package com.doccrawler.core.http;

import com.doccrawler.core.api.IPageFetcher;
import com.doccrawler.core.error.FetchException;
import com.doccrawler.core.model.FetchedPage;
import com.doccrawler.core.util.UrlUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 페이지 전송.
 * 리다이렉트는 따라가지 않는다: 3xx + Location 이면 {@link FetchedPage#redirect} 로 돌려주고
 * 이동할 주소의 범위/robots/방문 확인과 지연은 순회 엔진이 맡는다.
 * 그 밖에 2xx 가 아니면 FetchException.
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    static final String ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final Duration timeout;
    private final HttpSender sender;

    public HttpPageFetcher(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(Duration timeout, HttpSender testSender) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchedPage fetch(URI url, String userAgent) throws FetchException {
        Objects.requireNonNull(url, "url");
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, -1, "invalid request URL: " + url, e);
        }

        HttpResponse<byte[]> resp;
        try {
            resp = sender.send(req);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(url, -1, "interrupted while fetching " + url, e);
        } catch (IOException e) {
            throw new FetchException(url, -1, "I/O error fetching " + url + ": " + e, e);
        }

        int status = resp.statusCode();
        if (isRedirect(status)) {
            URI target = resp.headers().firstValue("Location").map(loc -> resolve(url, loc)).orElse(null);
            if (target == null) {
                throw new FetchException(url, status, "HTTP " + status + " without usable Location for " + url);
            }
            return FetchedPage.redirect(url, status, target);
        }
        if (status < 200 || status >= 300) {
            throw new FetchException(url, status, "HTTP " + status + " for " + url);
        }
        URI finalUri = resp.uri() != null ? resp.uri() : url;
        String contentType = resp.headers().firstValue("Content-Type").orElse(null);
        return new FetchedPage(url, finalUri, status, contentType, resp.body());
    }

    static boolean isRedirect(int s) {
        return s == 301 || s == 302 || s == 303 || s == 307 || s == 308;
    }

    private static URI resolve(URI base, String location) {
        URI loc = UrlUtils.parse(location);
        return loc == null ? null : base.resolve(loc);
    }
}
