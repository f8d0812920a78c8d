package com.doccrawler.core.crawler;

import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.CrawlScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScopePolicy — 도메인/접미사/예약 세그먼트")
class ScopePolicyTest {

    private static final CrawlScope SCOPE = CrawlScope.of(URI.create("https://docs.python.org/3/"));
    private final ScopePolicy policy = ScopePolicy.from(CrawlConfig.defaults(), SCOPE);

    private boolean in(String url) {
        return policy.isInScope(URI.create(url));
    }

    @Test
    void html_and_directory_pages_are_in_scope() {
        assertThat(in("https://docs.python.org/3/library/os.html")).isTrue();
        assertThat(in("https://docs.python.org/3/library/")).isTrue();
        assertThat(in("https://docs.python.org/2/tutorial/index.html")).isTrue(); // basePath 미적용(기본)
    }

    @Test
    @DisplayName("서브도메인/다른 호스트/다른 포트/비 http 스킴은 제외")
    void host_must_match_exactly() {
        assertThat(in("https://www.docs.python.org/3/a.html")).isFalse();
        assertThat(in("https://python.org/3/a.html")).isFalse();
        assertThat(in("https://docs.python.org:8443/3/a.html")).isFalse();
        assertThat(in("ftp://docs.python.org/3/a.html")).isFalse();
        assertThat(in("https://DOCS.python.org/3/a.html")).isTrue();
    }

    @Test
    void non_page_paths_are_out_of_scope() {
        assertThat(in("https://docs.python.org/3/archives/python.pdf")).isFalse();
        assertThat(in("https://docs.python.org/3/library/os")).isFalse();
        assertThat(in("https://docs.python.org/3/objects.inv")).isFalse();
    }

    @Test
    void reserved_segments_are_excluded() {
        assertThat(in("https://docs.python.org/3/_sources/index.html")).isFalse();
        assertThat(in("https://docs.python.org/3/_static/")).isFalse();
        assertThat(in("https://docs.python.org/3/_images_/x.html")).isTrue();
    }

    @Test
    void suffix_and_segments_are_configurable() {
        CrawlConfig cfg = CrawlConfig.defaults()
                .setPageSuffix(".htm")
                .setExcludedSegments(List.of("/private/"));
        ScopePolicy p = ScopePolicy.from(cfg, SCOPE);
        assertThat(p.isInScope(URI.create("https://docs.python.org/3/a.htm"))).isTrue();
        assertThat(p.isInScope(URI.create("https://docs.python.org/3/a.html"))).isFalse();
        assertThat(p.isInScope(URI.create("https://docs.python.org/3/_static/"))).isTrue();
        assertThat(p.isInScope(URI.create("https://docs.python.org/private/a.htm"))).isFalse();
    }

    @Test
    @DisplayName("stayUnderBasePath=true 이면 시드 디렉터리 밖은 제외")
    void stay_under_base_path() {
        ScopePolicy p = ScopePolicy.from(CrawlConfig.defaults().setStayUnderBasePath(true), SCOPE);
        assertThat(p.isInScope(URI.create("https://docs.python.org/3/library/"))).isTrue();
        assertThat(p.isInScope(URI.create("https://docs.python.org/2/library/"))).isFalse();
    }

    @Test
    void default_port_is_same_site() {
        ScopePolicy p = ScopePolicy.from(CrawlConfig.defaults(), CrawlScope.of(URI.create("http://ex.com/")));
        assertThat(p.isInScope(URI.create("http://ex.com:80/a.html"))).isTrue();
        assertThat(p.isSameSite(URI.create("http://ex.com/docs"))).isTrue();
    }
}
