package com.webharvest.core.discovery;

import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 1단계: 사이트맵.
 * /sitemap.xml, /sitemap_index.xml, robots.txt 의 Sitemap: 지시어를 순서대로 시도한다.
 */
public final class SitemapDiscovery implements DiscoveryStage {

    private static final Logger LOG = LoggerFactory.getLogger(SitemapDiscovery.class);

    static final long MAX_SITEMAP_BYTES = 20L * 1024 * 1024;
    static final int MAX_DEPTH = 3;

    @Override public String name() { return "sitemap"; }

    @Override
    public Set<String> discover(DiscoveryContext ctx) {
        List<URI> roots = new ArrayList<>();
        roots.add(UrlUtils.siteRoot(ctx.base(), "/sitemap.xml"));
        roots.add(UrlUtils.siteRoot(ctx.base(), "/sitemap_index.xml"));
        for (String s : ctx.robots().sitemaps()) {
            try {
                roots.add(URI.create(s));
            } catch (IllegalArgumentException e) {
                LOG.debug("Ignoring malformed robots sitemap entry: {}", s);
            }
        }

        Set<String> out = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        for (URI root : roots) {
            collect(ctx, root, 0, visited, out);
        }
        return out;
    }

    private void collect(DiscoveryContext ctx, URI sitemapUri, int depth,
                         Set<String> visited, Set<String> out) {
        if (!visited.add(sitemapUri.toString())) return;

        Duration timeout = ctx.config().getDiscovery().getSitemapTimeout();
        Optional<FetchResult> resp = ctx.getOk(sitemapUri, timeout);
        if (resp.isEmpty()) return;

        byte[] body = resp.get().getBody();
        if (body.length > MAX_SITEMAP_BYTES) {
            LOG.warn("Sitemap {} too large ({} bytes), skipping", sitemapUri, body.length);
            return;
        }

        SitemapParser.Result parsed = SitemapParser.parse(resp.get().text(), ctx.heuristic()::isContentUrl);
        LOG.debug("Sitemap {}: nested={}, processed={}, accepted={}",
                sitemapUri, parsed.nestedSitemaps().size(), parsed.processedEntries(), parsed.urls().size());

        // 중첩 사이트맵(인덱스) 재귀 - 누적 1,000 초과 시 중단
        if (depth < MAX_DEPTH) {
            for (String loc : parsed.nestedSitemaps()) {
                if (out.size() > SitemapParser.EARLY_STOP_ACCEPTED) {
                    LOG.info("Sitemap URL limit reached, stopping nested processing");
                    break;
                }
                try {
                    collect(ctx, URI.create(loc), depth + 1, visited, out);
                } catch (IllegalArgumentException e) {
                    LOG.debug("Malformed nested sitemap loc: {}", loc);
                }
            }
        }
        for (String u : parsed.urls()) {
            String clean = UrlUtils.stripFragment(u);
            if (clean != null) out.add(clean);
        }
    }
}
