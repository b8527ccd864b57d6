package com.webharvest.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentItemTest {

    @Test
    void blank_title_becomes_untitled_and_null_type_blog() {
        ContentItem it = new ContentItem("  ", "body", null, "https://a.com/x");
        assertThat(it.getTitle()).isEqualTo(ContentItem.UNTITLED);
        assertThat(it.getContentType()).isEqualTo(ContentType.BLOG);
    }

    @Test
    void with_copies_do_not_touch_original() {
        ContentItem it = new ContentItem("T", "body", ContentType.NEWS, "https://a.com/x");
        ContentItem t2 = it.withTitle("T2");
        ContentItem c2 = it.withContent("other");

        assertThat(it.getTitle()).isEqualTo("T");
        assertThat(it.getContent()).isEqualTo("body");
        assertThat(t2.getTitle()).isEqualTo("T2");
        assertThat(t2.getContentType()).isEqualTo(ContentType.NEWS);
        assertThat(c2.getContent()).isEqualTo("other");
        assertThat(c2.getSourceUrl()).isEqualTo("https://a.com/x");
    }

    @Test
    void minimum_content_uses_trimmed_length() {
        String ninetyNine = "x".repeat(99);
        assertThat(new ContentItem("t", "   " + ninetyNine + "   ", null, "https://a.com").hasMinimumContent()).isFalse();
        assertThat(new ContentItem("t", ninetyNine + "y", null, "https://a.com").hasMinimumContent()).isTrue();
    }

    @Test
    void blank_content_is_rejected() {
        assertThatThrownBy(() -> new ContentItem("t", "  \n ", null, "https://a.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("content");
        assertThatThrownBy(() -> new ContentItem("t", "", null, "https://a.com"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
