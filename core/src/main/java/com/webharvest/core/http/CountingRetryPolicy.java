package com.webharvest.core.http;

import com.webharvest.core.model.FetchResult;

import java.time.Duration;
import java.util.Objects;

/** 허용된 재시도 수를 세는 래퍼. 상태가 있으므로 URL 한 건마다 새로 만든다 */
public final class CountingRetryPolicy implements RetryPolicy {

    private final RetryPolicy delegate;
    private int granted;

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    @Override
    public boolean shouldRetry(FetchResult result, FetchException failure, int attempt) {
        boolean retry = delegate.shouldRetry(result, failure, attempt);
        if (retry) granted++;
        return retry;
    }

    @Override
    public Duration backoff(int attempt) {
        return delegate.backoff(attempt);
    }

    public int retries() {
        return granted;
    }
}
