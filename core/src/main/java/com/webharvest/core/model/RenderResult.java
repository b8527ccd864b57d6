package com.webharvest.core.model;

import java.util.List;
import java.util.Objects;

/** 브라우저 렌더 결과: 렌더된 HTML + 제목 + 절대 링크 목록 */
public record RenderResult(String html, String title, List<String> links, String finalUrl) {
    public RenderResult {
        html = Objects.requireNonNullElse(html, "");
        title = Objects.requireNonNullElse(title, "");
        links = (links == null ? List.of() : List.copyOf(links));
        Objects.requireNonNull(finalUrl, "finalUrl");
    }
}
