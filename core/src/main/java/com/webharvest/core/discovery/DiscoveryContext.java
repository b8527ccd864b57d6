package com.webharvest.core.discovery;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.discovery.robots.RobotsFile;
import com.webharvest.core.http.FetchException;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * 한 번의 탐색 실행 동안 단계들이 공유하는 상태.
 * robots.txt 는 최초 요청 시 한 번만 받아온다.
 */
public final class DiscoveryContext {

    private static final Logger LOG = LoggerFactory.getLogger(DiscoveryContext.class);

    private final URI base;
    private final IPageFetcher fetcher;
    private final ScrapeConfig config;
    private final ContentUrlHeuristic heuristic;
    private RobotsFile robots;   // lazy

    public DiscoveryContext(URI base, IPageFetcher fetcher, ScrapeConfig config) {
        this.base = Objects.requireNonNull(base, "base");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.config = Objects.requireNonNull(config, "config");
        this.heuristic = new ContentUrlHeuristic(base);
    }

    public URI base() { return base; }
    public ScrapeConfig config() { return config; }
    public ContentUrlHeuristic heuristic() { return heuristic; }

    /**
     * 200 응답만 돌려준다. 비 200/네트워크 실패는 debug 로그 후 empty.
     * 인터럽트는 취소로 전파.
     */
    public Optional<FetchResult> getOk(URI uri, Duration timeout) {
        try {
            FetchResult r = fetcher.fetch(uri, timeout);
            if (r.isOk()) return Optional.of(r);
            LOG.debug("Discovery lookup {} -> HTTP {}", uri, r.getStatus());
            return Optional.empty();
        } catch (FetchException e) {
            if (e.getKind() == FetchException.Kind.INTERRUPTED) {
                throw new CancellationException("Interrupted while probing " + uri);
            }
            LOG.debug("Discovery lookup {} failed: {}", uri, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<FetchResult> getOk(URI uri) {
        return getOk(uri, config.getDiscovery().getLookupTimeout());
    }

    public synchronized RobotsFile robots() {
        if (robots == null) {
            robots = getOk(UrlUtils.siteRoot(base, "/robots.txt"))
                    .map(r -> RobotsFile.parse(r.text()))
                    .orElse(RobotsFile.EMPTY);
        }
        return robots;
    }
}
