package com.webharvest.core.extract;

import com.webharvest.core.model.ContentItem;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TitleResolverTest {

    @Test
    void og_title_beats_twitter_and_json_ld() {
        Document doc = Jsoup.parse("<html><head>"
                + "<meta property=\"og:title\" content=\"OG Title\">"
                + "<meta name=\"twitter:title\" content=\"TW Title\">"
                + "<script type=\"application/ld+json\">{\"headline\":\"LD Title\"}</script>"
                + "</head><body></body></html>");
        assertThat(TitleResolver.metadataTitle(doc)).contains("OG Title");
    }

    @Test
    void json_ld_headline_preferred_over_name_even_inside_graph() {
        String ld = "{\"@graph\":[{\"@type\":\"WebSite\",\"name\":\"Site\"},"
                + "{\"@type\":\"Article\",\"headline\":\"Real Headline\"}]}";
        assertThat(TitleResolver.jsonLdTitle(ld)).contains("Real Headline");
        assertThat(TitleResolver.jsonLdTitle("[{\"name\":\"Only Name\"}]")).contains("Only Name");
        assertThat(TitleResolver.jsonLdTitle("{broken")).isEmpty();
    }

    @Test
    void falls_back_heading_then_document_title_then_untitled() {
        assertThat(TitleResolver.resolve(Optional.empty(), "intro\n\n# Heading One\n\ntext", "Doc"))
                .isEqualTo("Heading One");
        assertThat(TitleResolver.resolve(Optional.empty(), "## Not level one\n\ntext", "Doc"))
                .isEqualTo("Doc");
        assertThat(TitleResolver.resolve(Optional.of(" "), "text", " "))
                .isEqualTo(ContentItem.UNTITLED);
    }
}
