package com.webharvest.core.render;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** 브라우저 없이 검증 가능한 링크 수집 규칙 */
class PlaywrightRendererTest {

    @Test
    void api_json_url_fields_are_collected_recursively() throws Exception {
        String json = "{\"data\":{\"posts\":[{\"slug\":\"/blog/a\",\"title\":\"A\"},"
                + "{\"link\":\"https://example.com/blog/b\",\"meta\":{\"path\":\"/blog/c\"}}],"
                + "\"url\":42}}";
        List<String> out = new ArrayList<>();
        PlaywrightRenderer.collectJsonUrls(new ObjectMapper().readTree(json), out);
        assertThat(out).containsExactly("/blog/a", "https://example.com/blog/b", "/blog/c");
    }

    @Test
    void api_like_response_urls() {
        assertThat(PlaywrightRenderer.looksLikeApi("https://example.com/api/posts?page=2")).isTrue();
        assertThat(PlaywrightRenderer.looksLikeApi("https://example.com/data/posts.json")).isTrue();
        assertThat(PlaywrightRenderer.looksLikeApi("https://example.com/graphql")).isTrue();
        assertThat(PlaywrightRenderer.looksLikeApi("https://example.com/styles/main.css")).isFalse();
    }

    @Test
    void rendered_link_filter_accepts_posts_and_rejects_utility_pages() {
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://example.com/blog/hello")).isTrue();
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://writer.substack.com/p/hello")).isTrue();
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://example.com/team/alice")).isTrue();
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://writer.substack.com/t/topic")).isFalse();
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://example.com/archive")).isFalse();
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://example.com/")).isFalse();
        assertThat(PlaywrightRenderer.isLikelyPostUrl("https://example.com/flat")).isFalse();
    }
}
