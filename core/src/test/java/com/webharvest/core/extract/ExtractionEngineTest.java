package com.webharvest.core.extract;

import com.webharvest.core.api.IPageFetcher;
import com.webharvest.core.http.FetchException;
import com.webharvest.core.model.ContentItem;
import com.webharvest.core.model.ContentType;
import com.webharvest.core.model.FetchResult;
import com.webharvest.core.model.ScrapeConfig;
import com.webharvest.core.model.ScrapeStats;
import com.webharvest.core.render.FakeRenderer;
import com.webharvest.core.util.ProgressListener;
import com.webharvest.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionEngineTest {

    private static final String SHELL = "<html><body><div id=\"app\"></div><script src=\"/bundle.js\"></script></body></html>";

    private static ScrapeConfig cfg(int cc) {
        return ScrapeConfig.defaults().setBaseUrl("https://example.com/").setMaxConcurrent(cc);
    }

    private static FetchResult ok(URI uri, String html) {
        return FetchResult.builder().requestUri(uri).status(200)
                .contentType("text/html; charset=utf-8").body(html).build();
    }

    private static ExtractionEngine engine(ScrapeConfig c, IPageFetcher f, FakeRenderer r, ScrapeStats stats) {
        return new ExtractionEngine(c, f, r, stats, ExtractionEngine.defaultStrategies(), Sleeper.NONE);
    }

    @Test
    @DisplayName("150단어 article + h1 → h1 제목의 blog 항목 1건")
    void plain_article_becomes_single_blog_item() {
        String url = "https://example.com/posts/indoor-tomatoes";
        IPageFetcher f = (uri, t) -> ok(uri, HtmlFixtures.article("Growing Tomatoes Indoors", 150));

        List<ContentItem> items;
        try (ExtractionEngine e = engine(cfg(2), f, null, new ScrapeStats())) {
            items = e.extractAll(List.of(url), ProgressListener.NONE, null);
        }

        assertThat(items).hasSize(1);
        ContentItem it = items.get(0);
        assertThat(it.getTitle()).isEqualTo("Growing Tomatoes Indoors");
        assertThat(it.getContentType()).isEqualTo(ContentType.BLOG);
        assertThat(it.getSourceUrl()).isEqualTo(url);
        assertThat(it.getContent().trim().length()).isGreaterThanOrEqualTo(ContentItem.MIN_CONTENT_CHARS);
    }

    @Test
    void in_flight_extractions_never_exceed_max_concurrent() {
        final int CC = 3;
        AtomicInteger current = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        IPageFetcher f = (uri, t) -> {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(60);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } finally {
                current.decrementAndGet();
            }
            return ok(uri, HtmlFixtures.article("Post " + uri.getPath(), 150));
        };
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < 24; i++) urls.add("https://example.com/posts/p" + i);

        ScrapeStats stats = new ScrapeStats();
        List<ContentItem> items;
        try (ExtractionEngine e = engine(cfg(CC), f, null, stats)) {
            items = e.extractAll(urls, ProgressListener.NONE, null);
        }

        assertThat(peak.get()).isLessThanOrEqualTo(CC);
        assertThat(stats.snapshot().maxObservedConcurrency).isLessThanOrEqualTo(CC);
        assertThat(stats.snapshot().pagesAttempted).isEqualTo(24);
        assertThat(items).hasSize(24);
    }

    @Test
    @DisplayName("네트워크 오류 URL 은 결과만 빠지고 배치는 계속된다")
    void failures_are_isolated_per_url() {
        IPageFetcher f = (uri, t) -> {
            String p = uri.getPath();
            if (p.endsWith("/timeout")) throw new FetchException(FetchException.Kind.TIMEOUT, uri, "slow");
            if (p.endsWith("/bug")) throw new IllegalStateException("unexpected");
            if (p.endsWith("/gone")) return FetchResult.builder().requestUri(uri).status(404).build();
            return ok(uri, HtmlFixtures.article("Good Post", 150));
        };
        List<String> urls = List.of(
                "https://example.com/posts/timeout", "https://example.com/posts/bug",
                "https://example.com/posts/gone", "https://example.com/posts/good");

        List<ContentItem> items;
        try (ExtractionEngine e = engine(cfg(4), f, null, new ScrapeStats())) {
            items = e.extractAll(urls, ProgressListener.NONE, null);
        }

        assertThat(items).extracting(ContentItem::getSourceUrl).containsExactly("https://example.com/posts/good");
    }

    @Test
    void implausible_http_page_uses_renderer_when_available() {
        String url = "https://example.com/posts/spa";
        IPageFetcher f = (uri, t) -> ok(uri, SHELL);
        FakeRenderer renderer = new FakeRenderer().page(url, HtmlFixtures.article("Rendered Title", 150));
        ScrapeStats stats = new ScrapeStats();

        Optional<ContentItem> withBrowser;
        try (ExtractionEngine e = engine(cfg(2), f, renderer, stats)) {
            withBrowser = e.extractOne(url);
        }
        Optional<ContentItem> withoutBrowser;
        try (ExtractionEngine e = engine(cfg(2), f, null, new ScrapeStats())) {
            withoutBrowser = e.extractOne(url);
        }

        assertThat(withBrowser).map(ContentItem::getTitle).contains("Rendered Title");
        assertThat(renderer.rendered).containsExactly(url);
        assertThat(stats.snapshot().renderFallbacks).isEqualTo(1);
        assertThat(withoutBrowser).isEmpty();
    }

    @Test
    void render_failure_yields_no_item() {
        IPageFetcher f = (uri, t) -> { throw new FetchException(FetchException.Kind.CONNECTION, uri, "refused"); };
        try (ExtractionEngine e = engine(cfg(1), f, new FakeRenderer(), new ScrapeStats())) {
            assertThat(e.extractOne("https://example.com/posts/x")).isEmpty();
        }
    }

    @Test
    void progress_reports_every_url_in_extract_phase() {
        IPageFetcher f = (uri, t) -> ok(uri, HtmlFixtures.article("T", 150));
        List<String> phases = new ArrayList<>();
        AtomicInteger last = new AtomicInteger();
        ProgressListener pl = (p, phase, done, total) -> {
            synchronized (phases) { phases.add(phase); }
            last.accumulateAndGet((int) done, Math::max);
        };
        try (ExtractionEngine e = engine(cfg(2), f, null, new ScrapeStats())) {
            e.extractAll(List.of("https://example.com/posts/a", "https://example.com/posts/b"), pl, null);
        }
        assertThat(phases).hasSize(2).containsOnly("extract");
        assertThat(last.get()).isEqualTo(2);
    }

    @Test
    void cancel_flag_aborts_batch() {
        IPageFetcher f = (uri, t) -> ok(uri, HtmlFixtures.article("T", 150));
        AtomicBoolean cancel = new AtomicBoolean(true);
        try (ExtractionEngine e = engine(cfg(2), f, null, new ScrapeStats())) {
            assertThatThrownBy(() -> e.extractAll(List.of("https://example.com/posts/a"), ProgressListener.NONE, cancel))
                    .isInstanceOf(CancellationException.class);
        }
    }
}
