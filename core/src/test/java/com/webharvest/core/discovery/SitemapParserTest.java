package com.webharvest.core.discovery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapParserTest {

    @Test
    @DisplayName("3000개 항목 → 2000개까지만 처리, 반환은 100개 이하")
    void large_urlset_is_capped() {
        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\"?><urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">");
        for (int i = 0; i < 3000; i++) {
            String path = (i % 10 == 0) ? "/blog/post-" + i : "/p" + i;
            xml.append("<url><loc>https://example.com").append(path).append("</loc></url>");
        }
        xml.append("</urlset>");

        SitemapParser.Result r = SitemapParser.parse(xml.toString(), u -> u.contains("/blog/"));

        assertThat(r.processedEntries()).isEqualTo(SitemapParser.MAX_PROCESSED_ENTRIES);
        assertThat(r.urls()).hasSizeLessThanOrEqualTo(SitemapParser.MAX_RETURNED);
        assertThat(r.urls()).allMatch(u -> u.contains("/blog/"));
        // 2000 개 중 10개마다 1개 → 200개 채택, 상위 100개
        assertThat(r.urls()).hasSize(100);
        assertThat(r.urls().get(0)).isEqualTo("https://example.com/blog/post-0");
    }

    @Test
    void stops_early_once_enough_urls_are_accepted() {
        StringBuilder xml = new StringBuilder("<urlset>");
        for (int i = 0; i < 1500; i++) {
            xml.append("<url><loc>https://example.com/blog/p").append(i).append("</loc></url>");
        }
        xml.append("</urlset>");

        SitemapParser.Result r = SitemapParser.parse(xml.toString(), u -> true);
        assertThat(r.processedEntries()).isEqualTo(SitemapParser.EARLY_STOP_ACCEPTED);
    }

    @Test
    void sorted_by_lastmod_descending_with_undated_last() {
        String xml = "<urlset>"
                + "<url><loc>https://a.com/blog/old</loc><lastmod>2020-01-01</lastmod></url>"
                + "<url><loc>https://a.com/blog/undated</loc></url>"
                + "<url><loc>https://a.com/blog/new</loc><lastmod>2024-06-01T08:00:00+00:00</lastmod></url>"
                + "<url><loc>https://a.com/blog/mid</loc><lastmod>2022-03-15</lastmod></url>"
                + "</urlset>";

        SitemapParser.Result r = SitemapParser.parse(xml, u -> true);
        assertThat(r.urls()).containsExactly(
                "https://a.com/blog/new", "https://a.com/blog/mid",
                "https://a.com/blog/old", "https://a.com/blog/undated");
    }

    @Test
    void index_yields_at_most_three_nested_sitemaps() {
        String xml = "<sitemapindex>"
                + "<sitemap><loc>https://a.com/s1.xml</loc></sitemap>"
                + "<sitemap><loc>https://a.com/s2.xml</loc></sitemap>"
                + "<sitemap><loc>https://a.com/s3.xml</loc></sitemap>"
                + "<sitemap><loc>https://a.com/s4.xml</loc></sitemap>"
                + "</sitemapindex>";

        SitemapParser.Result r = SitemapParser.parse(xml, u -> true);
        assertThat(r.nestedSitemaps()).containsExactly(
                "https://a.com/s1.xml", "https://a.com/s2.xml", "https://a.com/s3.xml");
        assertThat(r.urls()).isEmpty();
    }

    @Test
    void date_parsing_tolerates_garbage() {
        assertThat(SitemapParser.parseDate("2024-02-29T10:00:00Z")).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(SitemapParser.parseDate("yesterday")).isNull();
        assertThat(SitemapParser.parseDate(" ")).isNull();
    }
}
