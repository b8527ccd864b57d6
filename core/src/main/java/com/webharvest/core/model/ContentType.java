package com.webharvest.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** 콘텐츠 분류. JSON 값은 소문자 스네이크 케이스(blog, podcast_transcript ...) */
public enum ContentType {
    BLOG,
    TUTORIAL,
    BOOK,
    NEWS,
    PODCAST_TRANSCRIPT,
    CALL_TRANSCRIPT,
    LINKEDIN_POST,
    REDDIT_COMMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
