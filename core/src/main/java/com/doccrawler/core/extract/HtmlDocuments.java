package com.doccrawler.core.extract;

import com.doccrawler.core.model.FetchedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;

/** FetchedPage → jsoup Document. charset 이 없으면 jsoup 이 meta/BOM 으로 감지 */
public final class HtmlDocuments {
    private HtmlDocuments() {}

    public static Document parse(FetchedPage page) throws IOException {
        Charset cs = page.charset();
        return Jsoup.parse(new ByteArrayInputStream(page.body()),
                cs == null ? null : cs.name(),
                page.finalUri().toString());
    }
}
