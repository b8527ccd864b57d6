package com.webharvest.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webharvest.core.model.ContentItem;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * 제목 결정 순서: 구조화 메타데이터(og:title, twitter:title, JSON-LD headline/name)
 * → 추출 본문의 첫 "# " 헤딩 → 문서 &lt;title&gt; → "Untitled"
 */
public final class TitleResolver {

    private static final ObjectMapper JSON = new ObjectMapper();

    private TitleResolver() {}

    public static String resolve(Optional<String> metadataTitle, String content, String documentTitle) {
        if (metadataTitle.isPresent() && !metadataTitle.get().isBlank()) return metadataTitle.get().trim();

        Optional<String> heading = firstHeading(content);
        if (heading.isPresent()) return heading.get();

        if (documentTitle != null && !documentTitle.isBlank()) return documentTitle.trim();
        return ContentItem.UNTITLED;
    }

    /** 변형 전 원본 문서에서 호출할 것 */
    public static Optional<String> metadataTitle(Document doc) {
        Optional<String> og = metaContent(doc, "meta[property=og:title]");
        if (og.isPresent()) return og;
        Optional<String> tw = metaContent(doc, "meta[name=twitter:title]");
        if (tw.isPresent()) return tw;

        for (Element s : doc.select("script[type=application/ld+json]")) {
            Optional<String> t = jsonLdTitle(s.data());
            if (t.isPresent()) return t;
        }
        return Optional.empty();
    }

    static Optional<String> firstHeading(String content) {
        if (content == null) return Optional.empty();
        for (String line : content.split("\n")) {
            String l = line.strip();
            if (l.startsWith("# ")) {
                String h = l.substring(2).trim();
                if (!h.isEmpty()) return Optional.of(h);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> metaContent(Document doc, String selector) {
        Element m = doc.selectFirst(selector);
        if (m == null) return Optional.empty();
        String v = m.attr("content").trim();
        return v.isEmpty() ? Optional.empty() : Optional.of(v);
    }

    /** headline 을 문서 전체에서 먼저 찾고, 없으면 name */
    static Optional<String> jsonLdTitle(String json) {
        if (json == null || json.isBlank()) return Optional.empty();
        try {
            JsonNode root = JSON.readTree(json);
            Optional<String> headline = findField(root, "headline");
            return headline.isPresent() ? headline : findField(root, "name");
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Optional<String> findField(JsonNode node, String field) {
        if (node == null) return Optional.empty();
        if (node.isArray()) {
            for (JsonNode n : node) {
                Optional<String> t = findField(n, field);
                if (t.isPresent()) return t;
            }
            return Optional.empty();
        }
        if (!node.isObject()) return Optional.empty();
        JsonNode v = node.get(field);
        if (v != null && v.isTextual() && !v.asText().isBlank()) return Optional.of(v.asText().trim());
        return findField(node.get("@graph"), field);
    }
}
