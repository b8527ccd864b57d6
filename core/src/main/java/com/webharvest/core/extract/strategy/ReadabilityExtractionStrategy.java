package com.webharvest.core.extract.strategy;

import com.webharvest.core.extract.MarkdownText;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 가독성(readability) 스타일 본문 탐지.
 * 문단 부모에 점수를 누적(쉼표 수, 길이, class/id 가중치, 링크 밀도 감점)하고
 * 최고 점수 후보 + 조건을 만족하는 형제 블록을 본문으로 본다.
 */
public final class ReadabilityExtractionStrategy extends AbstractJsoupStrategy {

    private static final Pattern POSITIVE = Pattern.compile(
            "article|body|content|entry|hentry|main|page|post|text|blog|story");
    private static final Pattern NEGATIVE = Pattern.compile(
            "comment|meta|footer|footnote|nav|sidebar|sponsor|ad-|share|promo|related|widget|menu|masthead");

    static final int MIN_PARAGRAPH_CHARS = 25;

    @Override public String name() { return "readability"; }

    @Override
    protected String extractText(Document doc) {
        doc.select("script, style, noscript, form, iframe, svg").remove();
        Element body = doc.body();
        if (body == null) return "";

        // ---- 1) 문단 점수를 부모/조부모에 누적 ----
        Map<Element, Double> scores = new IdentityHashMap<>();
        for (Element p : body.select("p, pre, td")) {
            String text = p.text();
            if (text.length() < MIN_PARAGRAPH_CHARS) continue;

            double s = 1.0 + countCommas(text) + Math.min(3, text.length() / 100);
            Element parent = p.parent();
            if (parent == null) continue;
            scores.merge(parent, s + classWeight(parent), (a, b) -> a + s);
            Element grand = parent.parent();
            if (grand != null) scores.merge(grand, s / 2 + classWeight(grand), (a, b) -> a + s / 2);
        }
        if (scores.isEmpty()) return "";

        // ---- 2) 링크 밀도 감점 후 최고 후보 ----
        Element top = null;
        double topScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Element, Double> e : scores.entrySet()) {
            double adjusted = e.getValue() * (1.0 - MarkdownText.linkDensity(e.getKey()));
            e.setValue(adjusted);
            if (adjusted > topScore) {
                topScore = adjusted;
                top = e.getKey();
            }
        }
        if (top == null) return "";

        // ---- 3) 형제 포함 ----
        Element parent = top.parent();
        if (parent == null) return MarkdownText.render(top);

        double threshold = Math.max(10.0, topScore * 0.2);
        StringBuilder sb = new StringBuilder();
        for (Element sib : parent.children()) {
            boolean include = (sib == top);
            if (!include) {
                Double s = scores.get(sib);
                if (s != null && s >= threshold) include = true;
                else if (sib.normalName().equals("p")) {
                    String t = sib.text();
                    double ld = MarkdownText.linkDensity(sib);
                    include = (t.length() > 80 && ld < 0.25)
                            || (t.length() <= 80 && ld == 0 && t.matches(".*\\.( |$).*"));
                }
            }
            if (!include) continue;
            String part = MarkdownText.render(sib);
            if (!part.isEmpty()) {
                if (sb.length() > 0) sb.append("\n\n");
                sb.append(part);
            }
        }
        return sb.toString();
    }

    private static double classWeight(Element el) {
        double w = 0;
        String cls = el.className().toLowerCase(Locale.ROOT);
        String id = el.id().toLowerCase(Locale.ROOT);
        if (!cls.isEmpty()) {
            if (NEGATIVE.matcher(cls).find()) w -= 25;
            if (POSITIVE.matcher(cls).find()) w += 25;
        }
        if (!id.isEmpty()) {
            if (NEGATIVE.matcher(id).find()) w -= 25;
            if (POSITIVE.matcher(id).find()) w += 25;
        }
        String tag = el.normalName();
        if (tag.equals("article") || tag.equals("main")) w += 10;
        else if (tag.equals("div")) w += 5;
        return w;
    }

    private static int countCommas(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) if (s.charAt(i) == ',') n++;
        return n;
    }
}
