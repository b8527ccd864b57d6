package com.webharvest.core.discovery;

import com.webharvest.core.http.FetchException;
import com.webharvest.core.model.ScrapeConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapDiscoveryTest {

    private static final URI BASE = URI.create("https://example.com/");

    private static DiscoveryContext ctx(FakeFetcher f) {
        return new DiscoveryContext(BASE, f, ScrapeConfig.defaults().setBaseUrl(BASE.toString()));
    }

    private static String urlset(String... paths) {
        StringBuilder sb = new StringBuilder("<urlset>");
        for (String p : paths) sb.append("<url><loc>https://example.com").append(p).append("</loc></url>");
        return sb.append("</urlset>").toString();
    }

    @Test
    void follows_index_into_at_most_three_nested_sitemaps() {
        String index = "<sitemapindex>"
                + "<sitemap><loc>https://example.com/s1.xml</loc></sitemap>"
                + "<sitemap><loc>https://example.com/s2.xml</loc></sitemap>"
                + "<sitemap><loc>https://example.com/s3.xml</loc></sitemap>"
                + "<sitemap><loc>https://example.com/s4.xml</loc></sitemap>"
                + "</sitemapindex>";
        FakeFetcher f = new FakeFetcher()
                .stub("https://example.com/sitemap.xml", 200, index, "application/xml")
                .stub("https://example.com/s1.xml", 200, urlset("/blog/a", "/about"), "application/xml")
                .stub("https://example.com/s2.xml", 200, urlset("/blog/b"), "application/xml")
                .stub("https://example.com/s3.xml", 200, urlset("/news/c"), "application/xml")
                .stub("https://example.com/s4.xml", 200, urlset("/blog/d"), "application/xml");

        var found = new SitemapDiscovery().discover(ctx(f));

        assertThat(found).containsExactlyInAnyOrder(
                "https://example.com/blog/a", "https://example.com/blog/b", "https://example.com/news/c");
        assertThat(f.requested).doesNotContain("https://example.com/s4.xml");
    }

    @Test
    void robots_sitemap_directive_is_followed_and_cycles_are_ignored() {
        String selfRef = "<sitemapindex><sitemap><loc>https://example.com/posts.xml</loc></sitemap></sitemapindex>";
        FakeFetcher f = new FakeFetcher()
                .stub("https://example.com/robots.txt", 200, "Sitemap: https://example.com/posts.xml\n", "text/plain")
                .stub("https://example.com/posts.xml", 200,
                        selfRef + urlset("/blog/x"), "application/xml");

        var found = new SitemapDiscovery().discover(ctx(f));

        assertThat(found).containsExactly("https://example.com/blog/x");
        assertThat(f.requested.stream().filter("https://example.com/posts.xml"::equals).count()).isEqualTo(1);
    }

    @Test
    void missing_or_failing_sitemaps_yield_nothing() {
        FakeFetcher f = new FakeFetcher()
                .fail("https://example.com/sitemap.xml", FetchException.Kind.TIMEOUT);
        assertThat(new SitemapDiscovery().discover(ctx(f))).isEmpty();
    }
}
