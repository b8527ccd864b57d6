package com.webharvest.core.model;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 스크랩 설정 (scrape.yml 매핑 대상). 순수 설정 보관용.
 * CLI 인자 오버라이드는 app-cli 쪽에서 처리.
 */
public final class ScrapeConfig {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; WebHarvest/0.1; +https://github.com/webharvest)";

    /** YAML `discovery:` 섹션 */
    public static final class DiscoveryCfg {
        private Duration sitemapTimeout = Duration.ofSeconds(8);
        private Duration lookupTimeout = Duration.ofSeconds(10);
        /** 이 개수 미만일 때만 SPA/네비게이션/브라우저 단계 실행 */
        private int fallbackThreshold = 5;
        /** robots.txt Disallow 존중 여부 (기본 false: Sitemap 지시어만 사용) */
        private boolean respectRobots = false;

        public Duration getSitemapTimeout() { return sitemapTimeout; }
        public DiscoveryCfg setSitemapTimeout(Duration v) { this.sitemapTimeout = v; return this; }
        public DiscoveryCfg setSitemapTimeoutMs(long ms) { this.sitemapTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public Duration getLookupTimeout() { return lookupTimeout; }
        public DiscoveryCfg setLookupTimeout(Duration v) { this.lookupTimeout = v; return this; }
        public DiscoveryCfg setLookupTimeoutMs(long ms) { this.lookupTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public int getFallbackThreshold() { return fallbackThreshold; }
        public DiscoveryCfg setFallbackThreshold(int v) { this.fallbackThreshold = v; return this; }

        public boolean isRespectRobots() { return respectRobots; }
        public DiscoveryCfg setRespectRobots(boolean v) { this.respectRobots = v; return this; }
    }

    /** YAML `render:` 섹션 */
    public static final class RenderCfg {
        private Duration timeout = Duration.ofSeconds(30);
        private Duration settle = Duration.ofSeconds(2);
        private boolean headless = true;

        public Duration getTimeout() { return timeout; }
        public RenderCfg setTimeout(Duration v) { this.timeout = v; return this; }
        public RenderCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public Duration getSettle() { return settle; }
        public RenderCfg setSettle(Duration v) { this.settle = v; return this; }
        public RenderCfg setSettleMs(long ms) { this.settle = Duration.ofMillis(Math.max(0, ms)); return this; }

        public boolean isHeadless() { return headless; }
        public RenderCfg setHeadless(boolean v) { this.headless = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String baseUrl;                // 대상 사이트 또는 단일 글 URL (필수)
    private int maxItems = 100;
    private boolean useBrowser = false;
    private int maxConcurrent = 10;        // 동시 추출 상한
    private int chunkSize = 8000;
    private Duration fetchTimeout = Duration.ofSeconds(15);
    private int strategyWorkers = 3;       // 전략 경합 풀 크기
    private int templateThreshold = 3;     // 같은 해시가 이 수를 넘으면 템플릿으로 간주
    private int httpMaxAttempts = 2;
    private String userAgent = DEFAULT_USER_AGENT;

    private final DiscoveryCfg discovery = new DiscoveryCfg();
    private final RenderCfg render = new RenderCfg();

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public int getMaxItems() { return maxItems; }
    public boolean isUseBrowser() { return useBrowser; }
    public int getMaxConcurrent() { return maxConcurrent; }
    public int getChunkSize() { return chunkSize; }
    public Duration getFetchTimeout() { return fetchTimeout; }
    public int getStrategyWorkers() { return strategyWorkers; }
    public int getTemplateThreshold() { return templateThreshold; }
    public int getHttpMaxAttempts() { return httpMaxAttempts; }
    public String getUserAgent() { return userAgent; }
    public DiscoveryCfg getDiscovery() { return discovery; }
    public RenderCfg getRender() { return render; }

    // ---------- fluent setters ----------
    public ScrapeConfig setBaseUrl(String baseUrl) { this.baseUrl = (baseUrl == null ? null : baseUrl.trim()); return this; }
    public ScrapeConfig setMaxItems(int maxItems) { this.maxItems = maxItems; return this; }
    public ScrapeConfig setUseBrowser(boolean v) { this.useBrowser = v; return this; }
    public ScrapeConfig setMaxConcurrent(int v) { this.maxConcurrent = v; return this; }
    public ScrapeConfig setChunkSize(int v) { this.chunkSize = v; return this; }
    public ScrapeConfig setFetchTimeout(Duration v) { this.fetchTimeout = v; return this; }
    public ScrapeConfig setFetchTimeoutMs(long ms) { this.fetchTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public ScrapeConfig setStrategyWorkers(int v) { this.strategyWorkers = v; return this; }
    public ScrapeConfig setTemplateThreshold(int v) { this.templateThreshold = v; return this; }
    public ScrapeConfig setHttpMaxAttempts(int v) { this.httpMaxAttempts = v; return this; }
    public ScrapeConfig setUserAgent(String v) { this.userAgent = v; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.isEmpty()) throw new IllegalArgumentException("baseUrl must not be empty");
        URI u;
        try {
            u = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("baseUrl is not a valid URL: " + baseUrl, e);
        }
        String scheme = (u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT));
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new IllegalArgumentException("baseUrl must be http(s): " + baseUrl);
        if (u.getHost() == null || u.getHost().isBlank())
            throw new IllegalArgumentException("baseUrl has no host: " + baseUrl);

        if (maxItems < 1) throw new IllegalArgumentException("maxItems must be >= 1");
        if (maxConcurrent < 1) throw new IllegalArgumentException("maxConcurrent must be >= 1");
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1");
        if (strategyWorkers < 1) throw new IllegalArgumentException("strategyWorkers must be >= 1");
        if (templateThreshold < 1) throw new IllegalArgumentException("templateThreshold must be >= 1");
        if (httpMaxAttempts < 1) throw new IllegalArgumentException("http.maxAttempts must be >= 1");
        requirePositive(fetchTimeout, "fetchTimeout");
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;

        requirePositive(discovery.getSitemapTimeout(), "discovery.sitemapTimeout");
        requirePositive(discovery.getLookupTimeout(), "discovery.lookupTimeout");
        if (discovery.getFallbackThreshold() < 0)
            throw new IllegalArgumentException("discovery.fallbackThreshold must be >= 0");

        requirePositive(render.getTimeout(), "render.timeout");
        if (render.getSettle() == null || render.getSettle().isNegative())
            throw new IllegalArgumentException("render.settle must be >= 0");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    // ---------- helpers ----------
    public static ScrapeConfig defaults() { return new ScrapeConfig(); }

    public URI baseUri() { return URI.create(baseUrl); }
}
