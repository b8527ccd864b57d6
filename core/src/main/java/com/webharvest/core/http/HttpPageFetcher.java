package com.webharvest.core.http;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.util.Sleeper;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * java.net.http.HttpClient 기반 페이지 수집기.
 * 스크랩당 1개 생성해 모든 워커가 공유한다(HttpClient 는 스레드 세이프).
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpPageFetcher(String userAgent, Duration connectTimeout) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        try {
            this.client = HttpClient.newBuilder()
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
                    .build();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Cannot create HTTP client", e);
        }
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(String userAgent, HttpSender testSender) {
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(URI uri, Duration timeout) throws FetchException {
        Objects.requireNonNull(uri, "uri");
        long start = System.nanoTime();
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(uri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchException.Kind.CONNECTION, uri, "Invalid request URI: " + uri, e);
        }

        HttpResponse<byte[]> resp;
        try {
            resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new FetchException(FetchException.Kind.TIMEOUT, uri, "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Kind.INTERRUPTED, uri, "Interrupted", e);
        } catch (ConnectException e) {
            throw new FetchException(FetchException.Kind.CONNECTION, uri, "Connection failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FetchException(FetchException.Kind.CONNECTION, uri, e.toString(), e);
        }

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        HttpHeaders hh = resp.headers();
        return FetchResult.builder()
                .requestUri(uri)
                .finalUri(resp.uri())
                .status(resp.statusCode())
                .headers(hh.map())
                .contentType(hh.firstValue("Content-Type").orElse(null))
                .body(resp.body())
                .elapsedMs(elapsedMs)
                .build();
    }

    /**
     * 재시도 포함 버전: 재시도 여부는 policy 가 판단, Retry-After(초) 우선(상한 30s).
     * 마지막 시도가 네트워크 실패면 그 예외를 그대로 던진다.
     */
    public FetchResult fetchWithRetry(URI uri, Duration timeout, RetryPolicy policy, Sleeper sleeper)
            throws FetchException {
        int attempt = 1;
        while (true) {
            FetchResult result = null;
            FetchException failure = null;
            try {
                result = fetch(uri, timeout);
            } catch (FetchException e) {
                if (e.getKind() == FetchException.Kind.INTERRUPTED) throw e;
                failure = e;
            }
            if (attempt >= policy.maxAttempts() || !policy.shouldRetry(result, failure, attempt)) {
                if (failure != null) throw failure;
                return result;
            }

            Duration delay = (result != null)
                    ? resolveRetryAfterOr(policy.backoff(attempt), result)
                    : policy.backoff(attempt);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new FetchException(FetchException.Kind.INTERRUPTED, uri, "Interrupted during retry backoff", ie);
            }
            attempt++;
        }
    }

    /** Retry-After 초 단위만 해석. HTTP-date 형식은 fallback 사용 */
    static Duration resolveRetryAfterOr(Duration fallback, FetchResult result) {
        List<String> values = result.getHeaders().get("Retry-After");
        if (values == null || values.isEmpty()) return fallback;
        try {
            long sec = Long.parseLong(values.get(0).trim());
            Duration d = Duration.ofSeconds(Math.max(0, sec));
            return d.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : d;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
