package com.webharvest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** 한 사이트 스크랩 결과. items 는 추가 순서 유지 */
@JsonPropertyOrder({"site", "items"})
public final class ScrapeResult {

    private final String site;
    private final List<ContentItem> items;

    @JsonCreator
    public ScrapeResult(@JsonProperty("site") String site,
                        @JsonProperty("items") List<ContentItem> items) {
        this.site = Objects.requireNonNull(site, "site");
        this.items = (items == null ? List.of() : List.copyOf(items));
    }

    public static ScrapeResult empty(String site) {
        return new ScrapeResult(site, List.of());
    }

    @JsonProperty("site")
    public String getSite() { return site; }

    @JsonProperty("items")
    public List<ContentItem> getItems() { return items; }

    @JsonIgnore
    public boolean isEmpty() { return items.isEmpty(); }

    @Override
    public String toString() {
        return "ScrapeResult{site=" + site + ", items=" + items.size() + '}';
    }
}
