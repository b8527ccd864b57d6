package com.webharvest.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 추출 결과 단위(불변).
 * - title 비어있으면 "Untitled"
 * - 청크 분할 시 with* 로 새 인스턴스 생성
 */
@JsonPropertyOrder({"title", "content", "content_type", "source_url"})
public final class ContentItem {

    public static final String UNTITLED = "Untitled";
    /** 유효 콘텐츠 최소 길이(trim 기준) */
    public static final int MIN_CONTENT_CHARS = 100;

    private final String title;
    private final String content;
    private final ContentType contentType;
    private final String sourceUrl;

    @JsonCreator
    public ContentItem(@JsonProperty("title") String title,
                       @JsonProperty("content") String content,
                       @JsonProperty("content_type") ContentType contentType,
                       @JsonProperty("source_url") String sourceUrl) {
        this.title = (title == null || title.isBlank()) ? UNTITLED : title.trim();
        this.content = Objects.requireNonNull(content, "content");
        if (content.isBlank()) throw new IllegalArgumentException("content must not be blank");
        this.contentType = (contentType != null ? contentType : ContentType.BLOG);
        this.sourceUrl = Objects.requireNonNull(sourceUrl, "sourceUrl");
    }

    @JsonProperty("title")
    public String getTitle() { return title; }

    @JsonProperty("content")
    public String getContent() { return content; }

    @JsonProperty("content_type")
    public ContentType getContentType() { return contentType; }

    @JsonProperty("source_url")
    public String getSourceUrl() { return sourceUrl; }

    public ContentItem withTitle(String newTitle) {
        return new ContentItem(newTitle, content, contentType, sourceUrl);
    }

    public ContentItem withContent(String newContent) {
        return new ContentItem(title, newContent, contentType, sourceUrl);
    }

    /** trim 후 최소 길이 충족 여부 */
    public boolean hasMinimumContent() {
        return content.trim().length() >= MIN_CONTENT_CHARS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentItem)) return false;
        ContentItem that = (ContentItem) o;
        return title.equals(that.title)
                && content.equals(that.content)
                && contentType == that.contentType
                && sourceUrl.equals(that.sourceUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, content, contentType, sourceUrl);
    }

    @Override
    public String toString() {
        return "ContentItem{title='" + title + "', type=" + contentType
                + ", url=" + sourceUrl + ", chars=" + content.length() + '}';
    }
}
