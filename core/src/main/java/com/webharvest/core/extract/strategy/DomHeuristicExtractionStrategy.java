package com.webharvest.core.extract.strategy;

import com.webharvest.core.extract.MarkdownText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Comparator;

/**
 * 일반 DOM 휴리스틱 전략.
 * main/article → 흔한 콘텐츠 셀렉터 → 가장 텍스트가 많은 div/section(200자 초과) 순으로 루트를 고른다.
 */
public final class DomHeuristicExtractionStrategy extends AbstractJsoupStrategy {

    static final String[] CONTENT_SELECTORS = {
            "[role=main]", ".content", ".main-content", ".post-content",
            ".article-content", ".blog-content", "#content", "#main",
            ".entry-content", ".post-body"
    };

    @Override public String name() { return "dom-heuristic"; }

    @Override
    protected String extractText(Document doc) {
        doc.select("script, style, noscript, nav, footer, header, aside").remove();
        Element root = findMainContent(doc);
        return root == null ? "" : MarkdownText.render(root);
    }

    static Element findMainContent(Document doc) {
        for (String tag : new String[]{"main", "article"}) {
            Element el = doc.selectFirst(tag);
            if (el != null) return el;
        }
        for (String sel : CONTENT_SELECTORS) {
            Element el = doc.selectFirst(sel);
            if (el != null) return el;
        }
        return doc.select("div, section").stream()
                .max(Comparator.comparingInt(e -> e.text().length()))
                .filter(e -> e.text().length() > 200)
                .orElse(null);
    }
}
