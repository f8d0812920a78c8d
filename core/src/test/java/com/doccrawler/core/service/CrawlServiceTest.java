package com.doccrawler.core.service;

import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.CrawlReport;
import com.doccrawler.core.model.OutputMode;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CrawlService — 로컬 HTTP 서버 대상 종단 테스트")
class CrawlServiceTest {

    private HttpServer server;
    private String base;
    private final Map<String, String> pages = new HashMap<>();
    private final Map<String, String> redirects = new HashMap<>();
    private final List<String> hits = Collections.synchronizedList(new ArrayList<>());
    private final List<Long> pageHitNanos = Collections.synchronizedList(new ArrayList<>());
    private volatile String robots;  // null → 404

    @TempDir
    Path out;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String path = ex.getRequestURI().getPath();
            hits.add(path + " UA=" + ex.getRequestHeaders().getFirst("User-Agent"));
            String body;
            int status;
            String type = "text/html; charset=utf-8";
            if (path.equals("/robots.txt")) {
                status = robots == null ? 404 : 200;
                body = robots == null ? "missing" : robots;
                type = "text/plain";
            } else if (redirects.containsKey(path)) {
                pageHitNanos.add(System.nanoTime());
                ex.getResponseHeaders().add("Location", redirects.get(path));
                ex.sendResponseHeaders(302, -1);
                ex.close();
                return;
            } else {
                pageHitNanos.add(System.nanoTime());
                body = pages.get(path);
                status = body == null ? 404 : 200;
                if (body == null) body = "not found";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", type);
            ex.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();

        pages.put("/docs/index.html", """
                <html><body><div role="main"><h1>Index</h1>
                <a href="page1.html">one</a> <a href="page2.html">two</a>
                <a href="_static/skip.html">static</a> <a href="missing.html">gone</a>
                </div></body></html>""");
        pages.put("/docs/page1.html", """
                <html><body><div role="main"><p>Page one</p><a href="index.html">back</a></div></body></html>""");
        pages.put("/docs/page2.html", """
                <html><body><div role="main"><p>Page two</p></div></body></html>""");
        pages.put("/docs/_static/skip.html", "<p>never</p>");
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private CrawlConfig config() {
        return CrawlConfig.defaults()
                .setTarget(base + "/docs/index.html")
                .setOutputDir(out)
                .setTimeout(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Crawl-delay 를 지키며 범위 안 페이지를 한 번씩 기록")
    void honors_crawl_delay_and_records_each_page_once() throws Exception {
        robots = "User-agent: *\nCrawl-delay: 0.2\nDisallow: /private/\n";

        CrawlReport report = new CrawlService(config()).run();

        assertThat(report.robotsFallback()).isFalse();
        assertThat(report.politenessDelay()).isEqualTo(Duration.ofMillis(200));
        assertThat(report.pagesRecorded()).isEqualTo(3);
        assertThat(report.pagesFailed()).isEqualTo(1);    // missing.html
        assertThat(hits).noneMatch(h -> h.startsWith("/docs/_static/"));
        assertThat(hits).allMatch(h -> h.endsWith("UA=DocCrawler/1.0"));
        assertThat(hits.stream().filter(h -> h.startsWith("/robots.txt")).count()).isEqualTo(1);
        assertThat(hits.stream().filter(h -> h.startsWith("/docs/page1.html")).count()).isEqualTo(1);

        List<Long> t = new ArrayList<>(pageHitNanos);
        assertThat(t).hasSize(4);
        for (int i = 1; i < t.size(); i++) {
            assertThat(Duration.ofNanos(t.get(i) - t.get(i - 1))).isGreaterThanOrEqualTo(Duration.ofMillis(190));
        }

        String md = Files.readString(out.resolve("crawled_content.md"));
        assertThat(md).contains("source: " + base + "/docs/index.html",
                "source: " + base + "/docs/page1.html", "source: " + base + "/docs/page2.html");
        assertThat(md).contains("Page one", "Page two");
        assertThat(md.split("\ncrawled_at: ", -1)).hasSize(4);

        String json = Files.readString(out.resolve(CrawlReportWriter.FILE_NAME));
        assertThat(json).contains("\"recorded\":3", "\"robotsFallback\":false", "\"politenessDelayMs\":200");
    }

    @Test
    @DisplayName("리다이렉트 대상도 범위/robots/지연을 거친다")
    void redirects_go_through_scope_robots_and_delay() throws Exception {
        robots = "User-agent: *\nCrawl-delay: 0.2\nDisallow: /private/\n";
        int port = server.getAddress().getPort();
        pages.put("/docs/hub.html", """
                <html><body><div role="main"><p>Hub</p>
                <a href="a.html">a</a> <a href="b.html">b</a> <a href="old.html">old</a>
                </div></body></html>""");
        redirects.put("/docs/a.html", "http://localhost:" + port + "/elsewhere/secret.html");
        redirects.put("/docs/b.html", "/private/hidden.html");
        redirects.put("/docs/old.html", "/docs/page2.html");
        pages.put("/elsewhere/secret.html", "<html><body><main><p>secret body</p></main></body></html>");
        pages.put("/private/hidden.html", "<html><body><main><p>hidden body</p></main></body></html>");

        CrawlReport report = new CrawlService(config().setTarget(base + "/docs/hub.html")).run();

        assertThat(hits).noneMatch(h -> h.startsWith("/elsewhere/"));
        assertThat(hits).noneMatch(h -> h.startsWith("/private/"));
        assertThat(report.pagesRecorded()).isEqualTo(2);
        assertThat(report.visitedUrls()).containsExactly(
                base + "/docs/hub.html", base + "/docs/a.html", base + "/docs/b.html",
                base + "/docs/old.html", base + "/docs/page2.html");

        String md = Files.readString(out.resolve("crawled_content.md"));
        assertThat(md).contains("source: " + base + "/docs/page2.html", "Page two")
                .doesNotContain("secret body", "hidden body", "source: " + base + "/docs/old.html");

        // 리다이렉트 응답과 이동한 주소 사이에도 Crawl-delay
        List<Long> t = new ArrayList<>(pageHitNanos);
        assertThat(t).hasSize(5);
        for (int i = 1; i < t.size(); i++) {
            assertThat(Duration.ofNanos(t.get(i) - t.get(i - 1))).isGreaterThanOrEqualTo(Duration.ofMillis(190));
        }
    }

    @Test
    @DisplayName("robots.txt 404 → 전체 허용 + 1.0s 지연")
    void robots_404_fails_open_with_one_second_delay() throws Exception {
        robots = null;

        CrawlReport report = new CrawlService(config().setMaxPages(1)).run();

        assertThat(report.robotsFallback()).isTrue();
        assertThat(report.politenessDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(report.elapsed()).isGreaterThanOrEqualTo(Duration.ofMillis(990));
        assertThat(report.pagesRecorded()).isEqualTo(1);
    }

    @Test
    void per_page_mode_writes_one_file_per_page() throws Exception {
        robots = "User-agent: *\nCrawl-delay: 0.01\n";

        new CrawlService(config().setOutputMode(OutputMode.PER_PAGE)).run();

        assertThat(out.resolve("index.txt")).exists();
        assertThat(out.resolve("page1.txt")).exists();
        assertThat(Files.readString(out.resolve("page2.txt"))).contains("Page two").doesNotContain("Page one");
        assertThat(out.resolve("crawled_content.md")).doesNotExist();
    }

    @Test
    @DisplayName("robots 가 모든 것을 막으면 기록 없음")
    void disallow_all_records_nothing() throws Exception {
        robots = "User-agent: *\nDisallow: /\n";

        CrawlReport report = new CrawlService(config()).run();

        assertThat(report.recordedAnything()).isFalse();
        assertThat(pageHitNanos).isEmpty();
    }
}
