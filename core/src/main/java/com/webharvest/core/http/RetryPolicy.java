package com.webharvest.core.http;

import com.webharvest.core.model.FetchResult;

import java.time.Duration;

/**
 * URL 한 건의 재시도 판단.
 * shouldRetry 에는 응답(result) 또는 실패(failure) 중 하나만 non-null 로 온다.
 */
public interface RetryPolicy {

    /** 첫 시도 포함 최대 시도 횟수 */
    int maxAttempts();

    /** attempt 는 방금 끝난 시도 번호(1부터) */
    boolean shouldRetry(FetchResult result, FetchException failure, int attempt);

    /** attempt 번째 실패 뒤의 기본 대기. Retry-After 가 있으면 호출 측이 우선한다 */
    Duration backoff(int attempt);
}
