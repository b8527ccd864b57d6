package com.webharvest.core.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import com.webharvest.core.api.IRenderer;
import com.webharvest.core.model.RenderResult;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Playwright(Chromium) 렌더러.
 * Playwright 객체는 생성한 스레드에서만 써야 하므로 전용 스레드 하나가 브라우저/컨텍스트를 소유하고
 * 모든 렌더 요청을 직렬로 처리한다. URL 마다 새 페이지를 열고 닫는다.
 */
public final class PlaywrightRenderer implements IRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightRenderer.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    static final int MAX_CLICK_CANDIDATES = 10;
    static final Set<String> JSON_URL_KEYS = Set.of("url", "link", "href", "slug", "path");

    private static final String LINKS_JS = "els => els.map(e => e.href)";
    private static final String DATA_ATTR_JS =
            "els => els.map(e => e.dataset.href || e.dataset.url || e.dataset.link || e.dataset.slug).filter(Boolean)";
    private static final String CLICKABLES_JS = String.join("\n",
            "() => {",
            "  const out = [];",
            "  const selectors = ['h1, h2, h3', '[class*=\"post\"]', '[class*=\"blog\"]',",
            "                     '[class*=\"article\"]', '[class*=\"card\"]', 'article'];",
            "  for (const sel of selectors) {",
            "    for (const el of document.querySelectorAll(sel)) {",
            "      const text = (el.textContent || '').trim();",
            "      const r = el.getBoundingClientRect();",
            "      if (text.length <= 10 || text.length >= 200 || r.width <= 0 || r.height <= 0) continue;",
            "      const clickable = el.onclick || el.closest('a') || el.closest('[onclick]')",
            "          || el.closest('[role=\"button\"]') || getComputedStyle(el).cursor === 'pointer';",
            "      if (clickable) out.push({selector: sel, text: text.substring(0, 100)});",
            "    }",
            "  }",
            "  return out.slice(0, " + MAX_CLICK_CANDIDATES + ");",
            "}");

    private final ScrapeConfig.RenderCfg cfg;
    private final RenderThread thread;
    // 아래는 render-thread 에서만 접근
    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;

    private PlaywrightRenderer(ScrapeConfig.RenderCfg cfg) {
        this.cfg = cfg;
        this.thread = new RenderThread("render-thread");
    }

    /**
     * 브라우저를 즉시 띄운다. 실패 시 IllegalStateException.
     */
    public static PlaywrightRenderer start(ScrapeConfig config) {
        Objects.requireNonNull(config, "config");
        PlaywrightRenderer r = new PlaywrightRenderer(config.getRender());
        try {
            r.thread.call("chromium", () -> {
                r.playwright = Playwright.create();
                r.browser = r.playwright.chromium().launch(
                        new BrowserType.LaunchOptions().setHeadless(r.cfg.isHeadless()));
                r.context = r.browser.newContext(
                        new Browser.NewContextOptions().setUserAgent(config.getUserAgent()));
                return null;
            }, Duration.ofSeconds(60));
        } catch (RenderException | RuntimeException e) {
            r.close();
            throw new IllegalStateException("Cannot start headless browser", e);
        }
        LOG.info("Headless browser started (headless={})", r.cfg.isHeadless());
        return r;
    }

    @Override
    public RenderResult render(String url, Duration timeout) throws RenderException {
        return thread.call(url, () -> {
            Page page = context.newPage();
            try {
                navigate(page, url, timeout);
                List<String> links = evalStrings(page, "a[href]", LINKS_JS);
                return new RenderResult(page.content(), page.title(), links, page.url());
            } catch (PlaywrightException e) {
                throw new RenderException(url, "Failed to render", e);
            } finally {
                closeQuietly(page);
            }
        }, budget(timeout));
    }

    @Override
    public Set<String> discoverLinks(String baseUrl) throws RenderException {
        Duration timeout = cfg.getTimeout();
        return thread.call(baseUrl, () -> {
            URI base = URI.create(baseUrl);
            Set<String> out = new LinkedHashSet<>();

            // ---- 1) 렌더된 앵커 + data-* 속성 + API 응답 ----
            List<Response> apiResponses = new ArrayList<>();
            Page page = context.newPage();
            List<ClickCandidate> candidates = new ArrayList<>();
            try {
                page.onResponse(resp -> {
                    if (looksLikeApi(resp.url())) apiResponses.add(resp);
                });
                navigate(page, baseUrl, timeout);

                addCandidates(base, evalStrings(page, "a[href]", LINKS_JS), out);
                addCandidates(base, evalStrings(page,
                        "[data-href], [data-url], [data-link], [data-slug]", DATA_ATTR_JS), out);

                for (Response resp : apiResponses) {
                    collectFromApiResponse(base, resp, out);
                }
                candidates = clickCandidates(page);
            } catch (PlaywrightException e) {
                throw new RenderException(baseUrl, "Link discovery failed", e);
            } finally {
                closeQuietly(page);
            }

            // ---- 2) 클릭 상호작용: 후보마다 새 페이지 ----
            for (ClickCandidate c : candidates) {
                Page clickPage = context.newPage();
                try {
                    navigate(clickPage, baseUrl, timeout);
                    for (ElementHandle el : clickPage.querySelectorAll(c.selector)) {
                        String text = el.textContent();
                        if (text == null || !text.contains(c.text)) continue;
                        el.click(new ElementHandle.ClickOptions().setTimeout(3000));
                        clickPage.waitForTimeout(2000);
                        String now = clickPage.url();
                        if (!now.equals(baseUrl)) addCandidates(base, List.of(now), out);
                        break;
                    }
                } catch (PlaywrightException e) {
                    LOG.debug("Click interaction failed on {} ({}): {}", baseUrl, c.selector, e.getMessage());
                } finally {
                    closeQuietly(clickPage);
                }
            }
            return out;
        }, budget(timeout).multipliedBy(MAX_CLICK_CANDIDATES + 2L));
    }

    // ------------ render-thread 내부 helpers ------------

    private void navigate(Page page, String url, Duration timeout) {
        page.navigate(url, new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.NETWORKIDLE)
                .setTimeout((double) timeout.toMillis()));
        long settle = cfg.getSettle().toMillis();
        if (settle > 0) page.waitForTimeout(settle);
    }

    private static List<String> evalStrings(Page page, String selector, String js) {
        Object v = page.evalOnSelectorAll(selector, js);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        }
        return out;
    }

    private record ClickCandidate(String selector, String text) {}

    private static List<ClickCandidate> clickCandidates(Page page) {
        Object v = page.evaluate(CLICKABLES_JS);
        List<ClickCandidate> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) {
                if (o instanceof Map<?, ?> m && m.get("selector") != null && m.get("text") != null) {
                    out.add(new ClickCandidate(String.valueOf(m.get("selector")), String.valueOf(m.get("text"))));
                }
            }
        }
        return out;
    }

    private static void collectFromApiResponse(URI base, Response resp, Set<String> out) {
        try {
            if (resp.status() != 200) return;
            String ct = resp.headerValue("content-type");
            if (ct == null || !ct.toLowerCase(Locale.ROOT).contains("json")) return;
            List<String> found = new ArrayList<>();
            collectJsonUrls(JSON.readTree(resp.text()), found);
            addCandidates(base, found, out);
        } catch (PlaywrightException | IOException e) {
            LOG.debug("Skipping API response {}: {}", resp.url(), e.getMessage());
        }
    }

    /** url/link/href/slug/path 키의 문자열 값 재귀 수집 */
    static void collectJsonUrls(JsonNode node, List<String> out) {
        if (node == null) return;
        if (node.isArray()) {
            for (JsonNode n : node) collectJsonUrls(n, out);
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (JSON_URL_KEYS.contains(e.getKey())) {
                    if (e.getValue().isTextual()) out.add(e.getValue().asText());
                } else {
                    collectJsonUrls(e.getValue(), out);
                }
            }
        }
    }

    static boolean looksLikeApi(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return u.endsWith(".json") || u.endsWith("/api/") || u.endsWith("/graphql") || u.contains("api");
    }

    private static void addCandidates(URI base, List<String> raw, Set<String> out) {
        for (String r : raw) {
            UrlUtils.resolve(base, r)
                    .filter(u -> UrlUtils.sameHost(base, u))
                    .filter(PlaywrightRenderer::isLikelyPostUrl)
                    .ifPresent(out::add);
        }
    }

    /** 렌더 링크용 느슨한 콘텐츠 판정(Substack /p/ 포함) */
    static boolean isLikelyPostUrl(String url) {
        String path = UrlUtils.lowerPath(url);
        for (String skip : List.of("/tag/", "/category/", "/author/", "/page/", "/search", "/login",
                "/register", "/contact", ".pdf", ".jpg", ".png", ".gif", ".css", ".js", "/api/",
                "/admin/", "/comments", "/share", "/subscribe", "/unsubscribe", "/archive",
                "/about", "/privacy", "/terms")) {
            if (path.contains(skip)) return false;
        }
        if (url.toLowerCase(Locale.ROOT).contains("substack.com") && path.contains("/t/")) return false;
        for (String ind : List.of("/blog/", "/post/", "/article/", "/news/", "/guide/", "/tutorial/", "/story/", "/p/")) {
            if (path.contains(ind)) return true;
        }
        return path.length() > 1 && path.chars().filter(ch -> ch == '/').count() >= 2;
    }

    private static void closeQuietly(Page page) {
        try {
            page.close();
        } catch (PlaywrightException e) {
            LOG.debug("Page close failed: {}", e.getMessage());
        }
    }

    // ------------ 시간 예산 ------------

    private Duration budget(Duration navTimeout) {
        return navTimeout.plus(cfg.getSettle()).plusSeconds(10);
    }

    @Override
    public void close() {
        thread.shutdown(() -> {
            if (context != null) context.close();
            if (browser != null) browser.close();
            if (playwright != null) playwright.close();
        }, Duration.ofSeconds(30));
    }
}
