package com.webharvest.core.discovery;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** 2단계: RSS/Atom 피드 엔트리 링크 (같은 호스트만). */
public final class FeedDiscovery implements DiscoveryStage {

    private static final Logger LOG = LoggerFactory.getLogger(FeedDiscovery.class);

    static final List<String> FEED_PATHS = List.of(
            "/feed", "/rss", "/feed.xml", "/rss.xml", "/atom.xml", "/blog/feed", "/blog/rss");

    @Override public String name() { return "feed"; }

    @Override
    public Set<String> discover(DiscoveryContext ctx) {
        Set<String> out = new LinkedHashSet<>();
        for (String path : FEED_PATHS) {
            URI feedUri = UrlUtils.siteRoot(ctx.base(), path);
            Optional<FetchResult> resp = ctx.getOk(feedUri);
            if (resp.isEmpty()) continue;

            try {
                SyndFeed feed = new SyndFeedInput().build(
                        new XmlReader(new ByteArrayInputStream(resp.get().getBody())));
                int before = out.size();
                for (SyndEntry entry : feed.getEntries()) {
                    String link = entry.getLink() != null ? entry.getLink() : entry.getUri();
                    UrlUtils.resolve(feedUri, link)
                            .filter(ctx.heuristic()::isSameHost)
                            .ifPresent(out::add);
                }
                LOG.debug("Feed {}: {} entry links", feedUri, out.size() - before);
            } catch (FeedException | IOException | IllegalArgumentException e) {
                LOG.debug("Feed {} not parseable: {}", feedUri, e.getMessage());
            }
        }
        return out;
    }
}
