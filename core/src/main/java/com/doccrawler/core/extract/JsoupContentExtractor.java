package com.doccrawler.core.extract;

import com.doccrawler.core.api.IContentExtractor;
import com.doccrawler.core.error.ExtractionException;
import com.doccrawler.core.model.FetchedPage;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 문서 사이트 HTML → 본문 텍스트.
 * 1) 스크립트/스타일/내비게이션/사이드바/헤더/푸터 제거
 * 2) 본문 루트 선택([role=main] → main → article → div.document → div.body → #content → body)
 * 3) 블록 단위로 텍스트를 뽑아 빈 줄로 구분. li 는 "- ", pre 는 원문 그대로
 */
public class JsoupContentExtractor implements IContentExtractor {

    static final String CHROME = String.join(", ",
            "script", "style", "noscript", "template", "iframe", "svg", "form",
            "nav", "header", "footer", "aside",
            "[role=navigation]", "[role=search]", "[role=banner]", "[role=contentinfo]",
            "div.sphinxsidebar", "div.related", "div.footer", "div.rst-versions",
            "nav.wy-nav-side", "div.wy-breadcrumbs", "a.headerlink");

    static final String[] MAIN_ROOTS = {
            "[role=main]", "main", "article", "div.document", "div.body", "#content"
    };

    private static final Set<String> TEXT_BLOCKS = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6", "dt", "dd", "caption", "figcaption");

    @Override
    public String extractText(FetchedPage page) throws ExtractionException {
        if (page == null) throw new ExtractionException("no page");
        if (!page.isHtml()) {
            throw new ExtractionException("not an HTML document: " + page.contentType()
                    + " (" + page.requestedUri() + ")");
        }
        Document doc;
        try {
            doc = HtmlDocuments.parse(page);
        } catch (IOException e) {
            throw new ExtractionException("cannot parse " + page.requestedUri(), e);
        }
        return extract(doc);
    }

    /** 파싱된 문서에서 본문 텍스트. 본문이 없으면 빈 문자열 */
    public String extract(Document doc) {
        doc.select(CHROME).remove();
        Element root = mainRoot(doc);
        if (root == null) return "";

        List<String> blocks = new ArrayList<>();
        walk(root, blocks);
        return String.join("\n\n", blocks).trim();
    }

    static Element mainRoot(Document doc) {
        for (String sel : MAIN_ROOTS) {
            Element e = doc.selectFirst(sel);
            if (e != null) return e;
        }
        return doc.body();
    }

    private void walk(Element el, List<String> out) {
        StringBuilder inline = new StringBuilder();
        for (Node child : el.childNodes()) {
            if (child instanceof TextNode tn) {
                inline.append(tn.text());
            } else if (child instanceof Element e) {
                if (!e.isBlock() && !isStructural(e)) {
                    inline.append(e.text());
                    continue;
                }
                flush(inline, out);
                block(e, out);
            }
        }
        flush(inline, out);
    }

    private void block(Element e, List<String> out) {
        String tag = e.normalName();
        if (tag.equals("pre")) {
            String code = e.wholeText().replaceAll("\\s+$", "");
            if (!code.isBlank()) out.add(code);
        } else if (tag.equals("li")) {
            Element copy = e.clone();
            for (Element n : new ArrayList<>(copy.children())) {
                if (isNestedBlock(n)) n.remove();
            }
            String own = copy.text().trim();
            if (!own.isEmpty()) out.add("- " + own);
            for (Element n : e.children()) {
                if (isNestedBlock(n)) block(n, out);
            }
        } else if (tag.equals("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : e.children()) {
                if (!cell.normalName().equals("th") && !cell.normalName().equals("td")) continue;
                String t = cell.text().trim();
                if (!t.isEmpty()) cells.add(t);
            }
            if (!cells.isEmpty()) out.add(String.join(" | ", cells));
        } else if (TEXT_BLOCKS.contains(tag)) {
            String t = e.text().trim();
            if (!t.isEmpty()) out.add(t);
        } else {
            walk(e, out);
        }
    }

    private static boolean isNestedBlock(Element e) {
        return switch (e.normalName()) {
            case "ul", "ol", "dl", "pre", "div" -> true;
            default -> false;
        };
    }

    private static boolean isStructural(Element e) {
        return switch (e.normalName().toLowerCase(Locale.ROOT)) {
            case "tr", "li", "pre", "dt", "dd", "table", "tbody", "thead", "tfoot" -> true;
            default -> false;
        };
    }

    private static void flush(StringBuilder inline, List<String> out) {
        String t = inline.toString().replaceAll("\\s+", " ").trim();
        if (!t.isEmpty()) out.add(t);
        inline.setLength(0);
    }
}
