package com.webharvest.core.discovery;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.api.IRenderer;
import com.webharvest.core.api.IUrlDiscoverer;
import com.webharvest.core.discovery.robots.RobotsFile;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * 계층형 URL 탐색기.
 * - 단계는 순서대로 실행, 결과는 누적 병합(LinkedHashSet)
 * - 폴백 단계는 누적 결과가 fallbackThreshold 미만일 때만
 * - 한 단계의 실패는 로그 후 건너뜀(다른 단계에 영향 없음)
 */
public final class UrlDiscoverer implements IUrlDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(UrlDiscoverer.class);
    private static final StructuredLog SLOG = StructuredLog.get(UrlDiscoverer.class);

    /** robots Disallow 판정용 UA 토큰 */
    static final String ROBOTS_AGENT = "webharvest";

    private final ScrapeConfig config;
    private final IPageFetcher fetcher;
    private final List<DiscoveryStage> stages;

    /** 기본 단계 구성. renderer 가 null 이 아니면 브라우저 단계 추가 */
    public UrlDiscoverer(ScrapeConfig config, IPageFetcher fetcher, IRenderer renderer) {
        this(config, fetcher, defaultStages(renderer));
    }

    /** DI/테스트용 */
    public UrlDiscoverer(ScrapeConfig config, IPageFetcher fetcher, List<DiscoveryStage> stages) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
    }

    public static List<DiscoveryStage> defaultStages(IRenderer renderer) {
        List<DiscoveryStage> list = new ArrayList<>();
        list.add(new SitemapDiscovery());
        list.add(new FeedDiscovery());
        list.add(new SectionPathDiscovery());
        list.add(new SpaLinkDiscovery());
        list.add(new NavigationDiscovery());
        if (renderer != null) list.add(new BrowserDiscovery(renderer));
        return list;
    }

    @Override
    public Set<String> discover(URI baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        DiscoveryContext ctx = new DiscoveryContext(baseUrl, fetcher, config);
        int threshold = config.getDiscovery().getFallbackThreshold();
        Set<String> urls = new LinkedHashSet<>();

        for (DiscoveryStage stage : stages) {
            if (Thread.currentThread().isInterrupted()) throw new CancellationException("Discovery interrupted");
            if (stage.isFallback() && urls.size() >= threshold) {
                LOG.debug("Skipping fallback stage {} ({} URLs already)", stage.name(), urls.size());
                continue;
            }
            try {
                Set<String> found = stage.discover(ctx);
                int before = urls.size();
                urls.addAll(found);
                LOG.info("Found {} URLs from {} ({} new)", found.size(), stage.name(), urls.size() - before);
                SLOG.info("discovery-stage", "stage", stage.name(),
                        "found", found.size(), "total", urls.size());
            } catch (CancellationException ce) {
                throw ce;
            } catch (DiscoveryException | RuntimeException e) {
                LOG.warn("Discovery stage {} failed: {}", stage.name(), e.toString());
                SLOG.error("discovery-stage-failed", e, "stage", stage.name());
            }
        }

        if (config.getDiscovery().isRespectRobots() && !urls.isEmpty()) {
            filterByRobots(ctx.robots(), urls);
        }
        return urls;
    }

    private static void filterByRobots(RobotsFile robots, Set<String> urls) {
        int before = urls.size();
        urls.removeIf(u -> {
            try {
                URI uri = URI.create(u);
                String pq = (uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath())
                        + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");
                return !robots.isAllowed(ROBOTS_AGENT, pq);
            } catch (IllegalArgumentException e) {
                return true;
            }
        });
        if (urls.size() < before) {
            LOG.info("robots.txt excluded {} candidate URLs", before - urls.size());
        }
    }
}
