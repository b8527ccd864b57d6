package com.webharvest.core.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * DOM 서브트리 → 마크다운 비슷한 평문.
 * 블록은 "\n\n" 으로 구분, h1~h6 는 "#" 접두, 목록은 "- ", pre 는 코드 펜스.
 */
public final class MarkdownText {

    private static final Set<String> BLOCK_TAGS = Set.of(
            "h1", "h2", "h3", "h4", "h5", "h6", "p", "pre", "ul", "ol", "li", "table",
            "blockquote", "figcaption", "dl", "dt", "dd", "div", "section", "article",
            "main", "aside", "header", "footer", "nav", "form", "figure", "hr", "br");

    private MarkdownText() {}

    public static String render(Element root) {
        return render(root, e -> true);
    }

    /** keep 이 false 인 요소는 하위 포함 통째로 건너뛴다 */
    public static String render(Element root, Predicate<Element> keep) {
        if (root == null) return "";
        List<String> blocks = new ArrayList<>();
        if (hasBlockDescendant(root)) walk(root, keep, blocks);
        else addIfText(blocks, root.text());
        return String.join("\n\n", blocks).trim();
    }

    private static void walk(Element parent, Predicate<Element> keep, List<String> blocks) {
        for (Node child : parent.childNodes()) {
            if (child instanceof TextNode tn) {
                addIfText(blocks, tn.text());
                continue;
            }
            if (!(child instanceof Element el) || !keep.test(el)) continue;

            String tag = el.normalName();
            switch (tag) {
                case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                    String text = el.text().trim();
                    if (!text.isEmpty()) {
                        int level = tag.charAt(1) - '0';
                        blocks.add("#".repeat(level) + " " + text);
                    }
                }
                case "pre" -> {
                    String code = el.wholeText().strip();
                    if (!code.isEmpty()) blocks.add("```\n" + code + "\n```");
                }
                case "ul", "ol" -> {
                    String items = el.children().stream()
                            .filter(li -> li.normalName().equals("li") && keep.test(li))
                            .map(li -> li.text().trim())
                            .filter(t -> !t.isEmpty())
                            .map(t -> "- " + t)
                            .collect(Collectors.joining("\n"));
                    if (!items.isEmpty()) blocks.add(items);
                }
                case "table" -> {
                    String rows = el.select("tr").stream()
                            .map(tr -> tr.select("th, td").stream()
                                    .map(Element::text).collect(Collectors.joining(" | ")))
                            .filter(r -> !r.isBlank())
                            .collect(Collectors.joining("\n"));
                    if (!rows.isEmpty()) blocks.add(rows);
                }
                case "blockquote" -> {
                    String text = el.text().trim();
                    if (!text.isEmpty()) blocks.add("> " + text);
                }
                case "br", "hr", "script", "style", "noscript", "template" -> { /* skip */ }
                default -> {
                    if (hasBlockDescendant(el)) walk(el, keep, blocks);
                    else addIfText(blocks, el.text());
                }
            }
        }
    }

    private static boolean hasBlockDescendant(Element el) {
        for (Element c : el.children()) {
            if (BLOCK_TAGS.contains(c.normalName()) || hasBlockDescendant(c)) return true;
        }
        return false;
    }

    private static void addIfText(List<String> blocks, String text) {
        String t = text == null ? "" : text.trim();
        if (!t.isEmpty()) blocks.add(t);
    }

    /** 링크 텍스트 비율(0~1) */
    public static double linkDensity(Element el) {
        int total = el.text().length();
        if (total == 0) return 0.0;
        int links = 0;
        for (Element a : el.select("a")) links += a.text().length();
        return Math.min(1.0, (double) links / total);
    }
}
