package com.webharvest.core.http;

import com.webharvest.core.model.FetchResult;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 429, 5xx, 타임아웃/연결 실패만 재시도.
 * 대기는 base, base*2, base*4 ... 에 ±10% 지터.
 */
public final class DefaultRetryPolicy implements RetryPolicy {

    public static final long DEFAULT_BASE_MILLIS = 250;

    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy(int maxAttempts) {
        this(maxAttempts, DEFAULT_BASE_MILLIS);
    }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    @Override
    public boolean shouldRetry(FetchResult result, FetchException failure, int attempt) {
        if (attempt >= maxAttempts) return false;
        if (failure != null) {
            return failure.getKind() == FetchException.Kind.TIMEOUT
                    || failure.getKind() == FetchException.Kind.CONNECTION;
        }
        int status = result.getStatus();
        return status == 429 || status >= 500;
    }

    @Override
    public Duration backoff(int attempt) {
        long raw = baseMillis << Math.min(20, Math.max(0, attempt - 1));
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }
}
