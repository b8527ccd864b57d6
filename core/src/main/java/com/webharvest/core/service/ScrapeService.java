package com.webharvest.core.service;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.api.IRenderer;
import com.webharvest.core.api.IUrlDiscoverer;
import com.webharvest.core.discovery.UrlDiscoverer;
import com.webharvest.core.extract.ExtractionEngine;
import com.webharvest.core.http.HttpPageFetcher;
import com.webharvest.core.model.ContentItem;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.model.ScrapeResult;
import com.webharvest.core.model.ScrapeStats;
import com.webharvest.core.process.ContentProcessor;
import com.webharvest.core.render.PlaywrightRenderer;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 스크랩 오케스트레이터:
 *  - discover → extract → process → ScrapeResult
 *  - HTTP 클라이언트/브라우저는 실행마다 한 번 만들고 finally 에서 정리
 *  - DI 생성자는 테스트용(가짜 fetcher/renderer/discoverer 주입)
 */
public final class ScrapeService {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeService.class);

    /** 특정 글이 아니라 목록으로 보는 경로(끝 슬래시 없이) */
    static final Set<String> SECTION_PATHS = Set.of(
            "/blog", "/blogs", "/articles", "/posts", "/news", "/resource", "/resources");

    private final ScrapeConfig config;
    private final Supplier<IPageFetcher> fetcherFactory;
    private final Supplier<IRenderer> rendererFactory;
    private final BiFunction<IPageFetcher, IRenderer, IUrlDiscoverer> discovererFactory;

    private volatile ScrapeStats stats = new ScrapeStats();
    private volatile int lastCandidateCount = 0;

    /** 기본 구현(JDK HttpClient + 필요 시 Playwright) */
    public ScrapeService(ScrapeConfig config) {
        this(config,
             () -> new HttpPageFetcher(config.getUserAgent(), Duration.ofSeconds(10)),
             () -> config.isUseBrowser() ? PlaywrightRenderer.start(config) : null,
             (fetcher, renderer) -> new UrlDiscoverer(config, fetcher, renderer));
    }

    /** DI/테스트용. rendererFactory 는 null 을 돌려줄 수 있다(브라우저 없음). */
    public ScrapeService(ScrapeConfig config,
                         Supplier<IPageFetcher> fetcherFactory,
                         Supplier<IRenderer> rendererFactory,
                         BiFunction<IPageFetcher, IRenderer, IUrlDiscoverer> discovererFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcherFactory = Objects.requireNonNull(fetcherFactory, "fetcherFactory");
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
        this.discovererFactory = Objects.requireNonNull(discovererFactory, "discovererFactory");
    }

    /* =========================
       실행 API (오버로드 3종)
       ========================= */

    public ScrapeResult run() {
        return run(ProgressListener.NONE, null);
    }

    public ScrapeResult run(ProgressListener listener) {
        return run(listener, null);
    }

    /** 진행률 + 취소 플래그(옵션). 취소 시 CancellationException */
    public ScrapeResult run(ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final String site = config.getBaseUrl();
        final URI base = config.baseUri();
        stats = new ScrapeStats();
        long t0 = System.nanoTime();

        LOG.info("Scrape start: site={}, maxItems={}, browser={}, cc={}",
                site, config.getMaxItems(), config.isUseBrowser(), config.getMaxConcurrent());
        SLOG.info("scrape-start",
                "site", site,
                "maxItems", config.getMaxItems(),
                "browser", config.isUseBrowser(),
                "cc", config.getMaxConcurrent());

        IPageFetcher fetcher = fetcherFactory.get();
        IRenderer renderer = rendererFactory.get();
        try {
            // ---- 1) 후보 URL ----
            checkCancel(cancelFlag);
            pl.step("discover", 0, -1);
            List<String> urls = candidates(base, fetcher, renderer);
            lastCandidateCount = urls.size();
            pl.step("discover", urls.size(), urls.size());
            if (urls.isEmpty()) {
                LOG.info("No URLs found for {}", site);
                return done(ScrapeResult.empty(site), t0);
            }

            // ---- 2) 추출 ----
            checkCancel(cancelFlag);
            List<ContentItem> extracted;
            try (ExtractionEngine engine = new ExtractionEngine(config, fetcher, renderer, stats)) {
                extracted = engine.extractAll(urls, pl, cancelFlag);
            }
            if (extracted.isEmpty()) {
                LOG.info("No content extracted from {} candidate URLs", urls.size());
                return done(ScrapeResult.empty(site), t0);
            }

            // ---- 3) 후처리 ----
            checkCancel(cancelFlag);
            pl.step("process", 0, extracted.size());
            List<ContentItem> items = new ContentProcessor(config.getTemplateThreshold(), config.getChunkSize())
                    .process(extracted);
            pl.step("process", items.size(), items.size());
            return done(new ScrapeResult(site, items), t0);
        } finally {
            if (renderer != null) {
                try {
                    renderer.close();
                } catch (RuntimeException e) {
                    LOG.warn("Renderer close failed: {}", e.toString());
                }
            }
        }
    }

    private List<String> candidates(URI base, IPageFetcher fetcher, IRenderer renderer) {
        if (isSpecificContentUrl(base)) {
            LOG.info("Direct URL mode: {}", config.getBaseUrl());
            return List.of(config.getBaseUrl());
        }
        Set<String> found = discovererFactory.apply(fetcher, renderer).discover(base);
        List<String> urls = new ArrayList<>(found);
        if (urls.size() > config.getMaxItems()) {
            LOG.info("Limiting {} discovered URLs to maxItems={}", urls.size(), config.getMaxItems());
            urls = new ArrayList<>(urls.subList(0, config.getMaxItems()));
        }
        return urls;
    }

    /** 경로가 있고, 끝 슬래시 없고, 목록 경로가 아니면 특정 글로 간주 */
    static boolean isSpecificContentUrl(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty() || "/".equals(path) || path.endsWith("/")) return false;
        return !SECTION_PATHS.contains(path.toLowerCase(Locale.ROOT));
    }

    private ScrapeResult done(ScrapeResult result, long t0) {
        ScrapeStats.Snapshot s = stats.snapshot();
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        LOG.info("Scrape done: items={}, pages={}, maxObservedCC={}, elapsedMs={}",
                result.getItems().size(), s.pagesAttempted, s.maxObservedConcurrency, ms);
        SLOG.info("scrape-done",
                "items", result.getItems().size(),
                "candidates", lastCandidateCount,
                "pages", s.pagesAttempted,
                "extracted", s.itemsExtracted,
                "requests", s.requestsTotal,
                "retries", s.retriesTotal,
                "renderFallbacks", s.renderFallbacks,
                "maxObservedCC", s.maxObservedConcurrency,
                "elapsedMs", ms);
        return result;
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException("Scrape cancelled");
        }
    }

    public ScrapeStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    /** 직전 실행의 후보 URL 수(maxItems 적용 후) */
    public int getCandidateCount() {
        return lastCandidateCount;
    }
}
