package com.webharvest.core.extract.strategy;

import com.webharvest.core.extract.MarkdownText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * 구조적 보일러플레이트 제거 전략.
 * 스크립트/네비/헤더/푸터/사이드바/공유/댓글/쿠키 배너를 걷어낸 뒤
 * 링크 밀도가 높은 블록을 버리고 나머지를 이어 붙인다.
 */
public final class StructuralExtractionStrategy extends AbstractJsoupStrategy {

    static final String[] BOILERPLATE_SELECTORS = {
            "script", "style", "noscript", "template", "iframe", "svg", "form", "button",
            "nav", "header", "footer", "aside",
            "[role=navigation]", "[role=banner]", "[role=contentinfo]", "[aria-hidden=true]",
            "[class*=cookie]", "[id*=cookie]", "[class*=share]", "[class*=social]",
            "[class*=comment]", "[id*=comment]", "[class*=sidebar]", "[id*=sidebar]",
            "[class*=newsletter]", "[class*=related]", "[class*=breadcrumb]", "[class*=advert]"
    };

    static final double MAX_LINK_DENSITY = 0.5;

    @Override public String name() { return "structural"; }

    @Override
    protected String extractText(Document doc) {
        Element body = doc.body();
        if (body == null) return "";
        for (String sel : BOILERPLATE_SELECTORS) {
            body.select(sel).remove();
        }
        return MarkdownText.render(body, el -> MarkdownText.linkDensity(el) <= MAX_LINK_DENSITY
                || el.text().length() > 400);
    }
}
