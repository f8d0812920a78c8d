package com.doccrawler.app;

import com.doccrawler.app.logging.LogSetup;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("App — 종료코드/출력")
class AppTest {

    private static final Map<String, String> SITE = Map.of(
            "/robots.txt", "User-agent: *\nCrawl-delay: 0.01\n",
            "/guide/index.html", "<html><body><main><h1>Guide</h1><a href=\"install.html\">install</a></main></body></html>",
            "/guide/install.html", "<html><body><main><p>pip install thing</p></main></body></html>");

    private HttpServer server;
    private String base;
    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    @TempDir
    Path tmp;

    @BeforeAll
    static void logs() throws IOException {
        // 로그 파일은 테스트 출력 디렉터리 밖으로
        LogSetup.init(Files.createTempDirectory("doc-crawler-test-logs"));
    }

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String body = SITE.get(ex.getRequestURI().getPath());
            byte[] bytes = (body == null ? "not found" : body).getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(body == null ? 404 : 200, bytes.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private int run(String... args) {
        return App.run(args,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void help_prints_usage() {
        assertThat(run("--help")).isZero();
        assertThat(out()).startsWith("Usage: doc-crawler");
    }

    @Test
    void missing_url_is_usage_error() {
        assertThat(run("--max-pages", "3")).isEqualTo(2);
        assertThat(err()).contains("no URL given");
    }

    @Test
    void bad_arguments_are_usage_errors() {
        assertThat(run("--frobnicate")).isEqualTo(2);
        assertThat(run("ftp://docs.test/")).isEqualTo(2);
        assertThat(run("--config", tmp.resolve("absent.yml").toString(), base + "/guide/")).isEqualTo(2);
        assertThat(err()).contains("unknown option --frobnicate", "config file not found");
    }

    @Test
    @DisplayName("사이트 크롤 성공 → 0, 집계 파일 생성")
    void crawls_site_and_exits_zero() throws Exception {
        Path outDir = tmp.resolve("out");

        int code = run("--output-dir", outDir.toString(), base + "/guide/index.html");

        assertThat(code).isZero();
        String md = Files.readString(outDir.resolve("crawled_content.md"));
        assertThat(md).contains("source: " + base + "/guide/index.html", "pip install thing");
        assertThat(out()).contains("[1] saved " + base + "/guide/index.html", "Crawl finished: 2 visited, 2 saved, 0 failed");
    }

    @Test
    @DisplayName("YAML 값 위에 CLI 값이 우선")
    void yaml_config_with_cli_override() throws Exception {
        Path outDir = tmp.resolve("from-yaml");
        Path yml = tmp.resolve("crawl.yml");
        Files.writeString(yml, """
                target: "%s/guide/index.html"
                maxPages: 5
                output:
                  dir: "%s"
                  mode: per_page
                """.formatted(base, outDir.toString().replace("\\", "/")));

        int code = run("--config", yml.toString(), "--max-pages", "1");

        assertThat(code).isZero();
        assertThat(outDir.resolve("index.txt")).exists();
        assertThat(outDir.resolve("install.txt")).doesNotExist();
        assertThat(out()).contains("[1/1] saved");
    }

    @Test
    @DisplayName("기록된 페이지가 없으면 3")
    void nothing_recorded_exits_three() {
        int code = run("--output-dir", tmp.resolve("empty").toString(), base + "/guide/missing.html");

        assertThat(code).isEqualTo(3);
        assertThat(out()).contains("0 saved, 1 failed");
    }
}
