package com.doccrawler.core.extract;

import com.doccrawler.core.error.ExtractionException;
import com.doccrawler.core.model.FetchedPage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsoupContentExtractor — Sphinx 레이아웃 본문 추출")
class JsoupContentExtractorTest {

    private final JsoupContentExtractor extractor = new JsoupContentExtractor();

    private static FetchedPage html(String body, String contentType) {
        URI u = URI.create("https://docs.test/3/os.html");
        return new FetchedPage(u, u, 200, contentType, body.getBytes(StandardCharsets.UTF_8));
    }

    private static final String SPHINX = """
            <html><head><title>os</title><script>var DOCUMENTATION_OPTIONS = {};</script>
            <style>body { color: red }</style></head>
            <body>
              <div class="related" role="navigation"><a href="index.html">index</a></div>
              <div class="document">
                <div class="body" role="main">
                  <h1>os — Miscellaneous interfaces<a class="headerlink" href="#os">¶</a></h1>
                  <p>This module provides a <em>portable</em> way of using features.</p>
                  <ul>
                    <li>First item</li>
                    <li>Second item
                      <ul><li>Nested item</li></ul>
                    </li>
                  </ul>
                  <pre>import os
            print(os.getcwd())</pre>
                  <table><tr><th>Name</th><th>Meaning</th></tr><tr><td>sep</td><td>separator</td></tr></table>
                  <dl><dt>os.name</dt><dd>The name of the OS.</dd></dl>
                </div>
              </div>
              <div class="sphinxsidebar" role="navigation"><h3>Navigation</h3></div>
              <div class="footer">© Copyright</div>
            </body></html>
            """;

    @Test
    void extracts_main_content_blocks() throws Exception {
        String text = extractor.extractText(html(SPHINX, "text/html; charset=utf-8"));

        assertThat(text).startsWith("os — Miscellaneous interfaces");
        assertThat(text).contains("This module provides a portable way of using features.");
        assertThat(text).contains("- First item", "- Second item", "- Nested item");
        assertThat(text).contains("import os\nprint(os.getcwd())");
        assertThat(text).contains("Name | Meaning", "sep | separator");
        assertThat(text).contains("os.name\n\nThe name of the OS.");
    }

    @Test
    void drops_chrome() throws Exception {
        String text = extractor.extractText(html(SPHINX, "text/html"));

        assertThat(text).doesNotContain("DOCUMENTATION_OPTIONS", "color: red", "Navigation", "Copyright", "¶");
    }

    @Test
    void falls_back_to_body() throws Exception {
        String text = extractor.extractText(html("<html><body><p>Hello</p><p>World</p></body></html>", null));
        assertThat(text).isEqualTo("Hello\n\nWorld");
    }

    @Test
    void non_html_is_rejected() {
        assertThatThrownBy(() -> extractor.extractText(html("%PDF-1.4", "application/pdf")))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("application/pdf");
    }

    @Test
    void empty_page_gives_empty_text() throws Exception {
        assertThat(extractor.extractText(html("<html><body><nav>menu</nav></body></html>", "text/html"))).isEmpty();
    }
}
