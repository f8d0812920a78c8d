package com.doccrawler.core.sink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PerPageFileSink — 파일 이름 규칙")
class PerPageFileSinkTest {

    @TempDir
    Path dir;

    private String name(String url) {
        return new PerPageFileSink(dir, ".html").fileNameFor(URI.create(url));
    }

    @Test
    void file_names_follow_the_url_path() {
        assertThat(name("https://docs.test/3/library/os.html")).isEqualTo("library_os.txt");
        assertThat(name("https://docs.test/3/library/")).isEqualTo("library.txt");
        assertThat(name("https://docs.test/3/")).isEqualTo("index.txt");
        assertThat(name("https://docs.test/")).isEqualTo("index.txt");
        assertThat(name("https://docs.test/index.html")).isEqualTo("index.txt");
        assertThat(name("https://docs.test/3/c-api/a%20b.html")).isEqualTo("c-api_a_b.txt");
    }

    @Test
    void writes_text_verbatim() throws Exception {
        PerPageFileSink sink = new PerPageFileSink(dir, ".html");
        sink.record(URI.create("https://docs.test/3/tutorial/index.html"), "Tutorial\n\n- step");

        assertThat(Files.readString(dir.resolve("tutorial_index.txt"))).isEqualTo("Tutorial\n\n- step");
        assertThat(sink.location()).isEqualTo(dir);
    }

    @Test
    @DisplayName("이름이 겹치면 덮어쓴다")
    void collisions_overwrite() throws Exception {
        PerPageFileSink sink = new PerPageFileSink(dir, ".html");
        sink.record(URI.create("https://docs.test/3/a/b.html"), "first");
        sink.record(URI.create("https://docs.test/2/a/b.html"), "second");

        assertThat(Files.readString(dir.resolve("a_b.txt"))).isEqualTo("second");
        try (var files = Files.list(dir)) {
            assertThat(files.count()).isEqualTo(1);
        }
    }
}
