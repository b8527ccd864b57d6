package com.webharvest.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScrapeStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);   // HTTP 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicLong pagesAttempted = new AtomicLong(0);
    private final AtomicLong itemsExtracted = new AtomicLong(0);
    private final AtomicLong renderFallbacks = new AtomicLong(0); // 브라우저 폴백 진입 횟수
    private final AtomicLong sumWallMs = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempts(long attempts) { requestsTotal.addAndGet(attempts); }
    public void addRetries(long retries) { retriesTotal.addAndGet(retries); }
    public void pageAttempted() { pagesAttempted.incrementAndGet(); }
    public void itemExtracted() { itemsExtracted.incrementAndGet(); }
    public void renderFallback() { renderFallbacks.incrementAndGet(); }
    public void addWallTimeMs(long wallMs) { sumWallMs.addAndGet(wallMs); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long pages = pagesAttempted.get();
        long avg = sumWallMs.get() / Math.max(1, pages);
        return new Snapshot(requestsTotal.get(), retriesTotal.get(), pages,
                itemsExtracted.get(), renderFallbacks.get(),
                maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final long pagesAttempted;
        public final long itemsExtracted;
        public final long renderFallbacks;
        public final int  maxObservedConcurrency;
        public final long avgPageMs;

        public Snapshot(long requestsTotal, long retriesTotal, long pagesAttempted,
                        long itemsExtracted, long renderFallbacks,
                        int maxObservedConcurrency, long avgPageMs) {
            this.requestsTotal = requestsTotal;
            this.retriesTotal = retriesTotal;
            this.pagesAttempted = pagesAttempted;
            this.itemsExtracted = itemsExtracted;
            this.renderFallbacks = renderFallbacks;
            this.maxObservedConcurrency = maxObservedConcurrency;
            this.avgPageMs = avgPageMs;
        }
    }
}
