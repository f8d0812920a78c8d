package com.doccrawler.core.crawler.robots;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpRobotsFetcher implements RobotsFetcher {
    private final HttpClient client;
    private final Duration timeout;

    /** 리다이렉트를 직접 판단해야 하므로 Redirect.NEVER 클라이언트를 쓴다 */
    public HttpRobotsFetcher(Duration timeout) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(timeout)
                .build(), timeout);
    }

    public HttpRobotsFetcher(HttpClient client, Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    @Override
    public Response fetch(URI robotsTxtUri, String userAgent) {
        try {
            HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                    .GET()
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .build();

            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            int code = res.statusCode();

            // 리다이렉트면 Location 헤더만 전달(본문은 무시)
            if (code == 301 || code == 302 || code == 303 || code == 307 || code == 308) {
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(robotsTxtUri);
                return new Response(code, "", next, null);
            }

            String body = res.body() == null ? "" : res.body();
            return Response.ok(code, body, robotsTxtUri);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted", robotsTxtUri);
        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString(), robotsTxtUri);
        }
    }
}
