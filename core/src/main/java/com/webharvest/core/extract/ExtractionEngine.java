package com.webharvest.core.extract;

import com.webharvest.core.api.IExtractionStrategy;
import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.api.IRenderer;
import com.webharvest.core.extract.strategy.DomHeuristicExtractionStrategy;
import com.webharvest.core.extract.strategy.ReadabilityExtractionStrategy;
import com.webharvest.core.extract.strategy.StructuralExtractionStrategy;
import com.webharvest.core.http.CountingRetryPolicy;
import com.webharvest.core.http.DefaultRetryPolicy;
import com.webharvest.core.http.FetchException;
import com.webharvest.core.http.HttpPageFetcher;
import com.webharvest.core.model.ContentItem;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.model.RenderResult;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.model.ScrapeStats;
import com.webharvest.core.render.RenderException;
import com.webharvest.core.util.NamedThreadFactory;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.Sleeper;
import com.webharvest.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 추출 엔진: URL 목록 → ContentItem 목록.
 *  - 세마포어(maxConcurrent) + 고정 워커 풀로 동시 처리 상한 보장
 *  - URL 별: HTTP 수집 → 타당성 검사 → 전략 경합 → (브라우저 모드) 렌더 후 재경합
 *  - URL 단위 예외는 로그 후 "결과 없음"으로 격리
 * 전략 풀은 엔진 수명 동안 공유, close() 로 정리한다.
 */
public final class ExtractionEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionEngine.class);
    private static final StructuredLog SLOG = StructuredLog.get(ExtractionEngine.class);

    private final ScrapeConfig config;
    private final IPageFetcher fetcher;
    private final IRenderer renderer;         // null 이면 브라우저 폴백 없음
    private final ScrapeStats stats;
    private final Sleeper sleeper;
    private final ExecutorService strategyPool;
    private final StrategyRace race;

    /** 기본 전략 순서: structural → readability → dom-heuristic */
    public static List<IExtractionStrategy> defaultStrategies() {
        return List.of(
                new StructuralExtractionStrategy(),
                new ReadabilityExtractionStrategy(),
                new DomHeuristicExtractionStrategy());
    }

    public ExtractionEngine(ScrapeConfig config, IPageFetcher fetcher, IRenderer renderer, ScrapeStats stats) {
        this(config, fetcher, renderer, stats, defaultStrategies(), Sleeper.SYSTEM);
    }

    /** DI/테스트용 */
    public ExtractionEngine(ScrapeConfig config, IPageFetcher fetcher, IRenderer renderer, ScrapeStats stats,
                            List<IExtractionStrategy> strategies, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.renderer = renderer;
        this.stats = Objects.requireNonNull(stats, "stats");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.strategyPool = Executors.newFixedThreadPool(
                Math.max(1, config.getStrategyWorkers()), new NamedThreadFactory("strategy-worker"));
        this.race = new StrategyRace(strategyPool, strategies);
    }

    /**
     * 전체 배치 추출. 결과 순서는 입력 순서 중 성공한 것만(의미 없음).
     * 취소 플래그/인터럽트 시 CancellationException.
     */
    public List<ContentItem> extractAll(List<String> urls, ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final int cc = Math.max(1, config.getMaxConcurrent());
        final int total = urls.size();
        if (total == 0) return List.of();

        LOG.info("Starting parallel extraction of {} URLs with maxConcurrent={}", total, cc);
        long t0 = System.nanoTime();

        // ---- 1) 고정 풀 + 세마포어(제출 전 획득, 작업 종료 시 반납) ----
        ExecutorService exec = Executors.newFixedThreadPool(cc, new NamedThreadFactory("extract-worker"));
        Semaphore permits = new Semaphore(cc);
        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);
        final List<Future<Optional<ContentItem>>> futures = new ArrayList<>(total);

        List<ContentItem> results = new ArrayList<>();
        try {
            // ---- 2) 작업 제출 ----
            for (String url : urls) {
                checkCancel(cancelFlag);
                try {
                    permits.acquire();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while waiting for extraction slot");
                }
                try {
                    futures.add(exec.submit(() -> {
                        try {
                            int cur = inFlight.incrementAndGet();
                            stats.observeConcurrency(cur);
                            checkCancel(cancelFlag);
                            return extractIsolated(url);
                        } finally {
                            stats.observeConcurrency(inFlight.decrementAndGet());
                            permits.release();
                            int d = done.incrementAndGet();
                            pl.step("extract", d, total);
                        }
                    }));
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
            }

            // ---- 3) 결과 수집 ----
            for (Future<Optional<ContentItem>> f : futures) {
                checkCancel(cancelFlag);
                try {
                    f.get().ifPresent(results::add);
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    if (cause instanceof CancellationException ce) throw ce;
                    LOG.warn("Extraction task failed: {}", cause.toString());
                    SLOG.error("task-failed", cause, "cause", cause.toString());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                }
            }
        } finally {
            // ---- 4) 종료 ----
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        long secs = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - t0);
        LOG.info("Parallel extraction completed in {}s: {}/{} successful", secs, results.size(), total);
        return results;
    }

    /** URL 한 건. 취소 외의 모든 예외를 empty 로 바꾼다. */
    Optional<ContentItem> extractIsolated(String url) {
        long t0 = System.nanoTime();
        stats.pageAttempted();
        try {
            Optional<ContentItem> item = extractOne(url);
            if (item.isPresent()) {
                stats.itemExtracted();
                SLOG.info("url-extracted", "url", url,
                        "type", item.get().getContentType().wireName(),
                        "chars", item.get().getContent().length());
            } else {
                SLOG.debug("url-empty", "url", url);
            }
            return item;
        } catch (CancellationException ce) {
            throw ce;
        } catch (RuntimeException e) {
            LOG.warn("Error extracting {}: {}", url, e.toString());
            SLOG.error("url-failed", e, "url", url);
            return Optional.empty();
        } finally {
            stats.addWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        }
    }

    /** HTTP → 경합 → (렌더 → 경합) */
    public Optional<ContentItem> extractOne(String url) {
        // ---- 1) 평문 HTTP ----
        byte[] body = fetchPlausible(url);
        if (body != null) {
            Optional<ContentItem> item = race.race(url, body);
            if (item.isPresent()) return item;
            LOG.debug("No qualifying strategy result for {} over HTTP", url);
        }

        // ---- 2) 브라우저 폴백 ----
        if (renderer == null) return Optional.empty();
        stats.renderFallback();
        try {
            RenderResult rendered = renderer.render(url, config.getRender().getTimeout());
            if (rendered.html().isBlank()) return Optional.empty();
            return race.race(url, rendered.html().getBytes(StandardCharsets.UTF_8));
        } catch (RenderException e) {
            LOG.debug("Browser rendering failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    /** 200 + 타당성 통과 시 본문, 아니면 null(결론 없음) */
    private byte[] fetchPlausible(String url) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            LOG.debug("Malformed URL skipped: {}", url);
            return null;
        }

        FetchResult resp;
        int retries = 0;
        try {
            if (fetcher instanceof HttpPageFetcher hf) {
                var counting = new CountingRetryPolicy(new DefaultRetryPolicy(config.getHttpMaxAttempts()));
                try {
                    resp = hf.fetchWithRetry(uri, config.getFetchTimeout(), counting, sleeper);
                } finally {
                    retries = counting.retries();
                }
            } else {
                resp = fetcher.fetch(uri, config.getFetchTimeout());
            }
        } catch (FetchException e) {
            if (e.getKind() == FetchException.Kind.INTERRUPTED) {
                throw new CancellationException("Interrupted while fetching " + url);
            }
            LOG.debug("HTTP request failed for {}: {}", url, e.getMessage());
            return null;
        } finally {
            stats.addAttempts(1L + retries);
            stats.addRetries(retries);
        }

        if (!resp.isOk()) {
            LOG.debug("HTTP {} for {} ({}ms)", resp.getStatus(), resp.getRequestUri(), resp.getElapsedMs());
            return null;
        }
        if (!Objects.equals(resp.getFinalUri(), resp.getRequestUri())) {
            LOG.debug("Redirected {} -> {}", resp.getRequestUri(), resp.getFinalUri());
        }
        String reason = HtmlValidity.check(resp.getBody());
        if (reason != null) {
            LOG.debug("Implausible HTML for {}: {}", url, reason);
            return null;
        }
        return resp.getBody();
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (Thread.currentThread().isInterrupted() || (flag != null && flag.get())) {
            throw new CancellationException();
        }
    }

    @Override
    public void close() {
        strategyPool.shutdownNow();
        try {
            strategyPool.awaitTermination(10, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
