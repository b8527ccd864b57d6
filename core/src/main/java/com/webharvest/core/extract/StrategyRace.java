package com.webharvest.core.extract;

import com.webharvest.core.api.IExtractionStrategy;
import com.webharvest.core.model.ContentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 한 문서에 대해 전략들을 공유 풀에서 동시에 돌리고,
 * 완료 순서대로 보다가 trim 길이가 임계값을 넘는 첫 결과를 채택한다.
 * 채택 즉시 나머지는 cancel(true) 로 인터럽트, 결과는 버린다.
 */
public final class StrategyRace {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyRace.class);

    public static final int QUALIFYING_CHARS = 200;

    private final ExecutorService pool;
    private final List<IExtractionStrategy> strategies;

    public StrategyRace(ExecutorService pool, List<IExtractionStrategy> strategies) {
        this.pool = Objects.requireNonNull(pool, "pool");
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
        if (this.strategies.isEmpty()) throw new IllegalArgumentException("at least one strategy required");
    }

    public Optional<ContentItem> race(String url, byte[] html) {
        CompletionService<Optional<ContentItem>> cs = new ExecutorCompletionService<>(pool);
        List<Future<Optional<ContentItem>>> futures = new ArrayList<>(strategies.size());
        for (IExtractionStrategy s : strategies) {
            futures.add(cs.submit(() -> s.extract(url, html)));
        }

        try {
            for (int i = 0; i < futures.size(); i++) {
                Future<Optional<ContentItem>> done;
                try {
                    done = cs.take();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted during strategy race for " + url);
                }
                try {
                    Optional<ContentItem> r = done.get();
                    if (r.isPresent() && qualifies(r.get())) {
                        LOG.debug("Race winner for {}: {} chars", url, r.get().getContent().length());
                        return r;
                    }
                } catch (ExecutionException e) {
                    LOG.debug("Strategy failed for {}: {}", url, String.valueOf(e.getCause()));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted during strategy race for " + url);
                }
            }
            return Optional.empty();
        } finally {
            for (Future<?> f : futures) {
                if (!f.isDone()) f.cancel(true);
            }
        }
    }

    static boolean qualifies(ContentItem item) {
        return item.getContent().trim().length() > QUALIFYING_CHARS;
    }
}
