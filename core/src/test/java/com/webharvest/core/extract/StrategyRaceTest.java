package com.webharvest.core.extract;

import com.webharvest.core.api.IExtractionStrategy;
import com.webharvest.core.model.ContentItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyRaceTest {

    private static final String URL = "https://example.com/blog/post";
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(3);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static IExtractionStrategy strategy(String name, Supplier<Optional<ContentItem>> body) {
        return new IExtractionStrategy() {
            @Override public String name() { return name; }
            @Override public Optional<ContentItem> extract(String url, byte[] html) { return body.get(); }
        };
    }

    private static Optional<ContentItem> item(String title, int chars) {
        return Optional.of(new ContentItem(title, "y".repeat(chars), null, URL));
    }

    @Test
    void first_qualifying_result_wins_and_slow_loser_is_interrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        IExtractionStrategy slow = strategy("slow", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return item("slow", 5000);
        });
        IExtractionStrategy fast = strategy("fast", () -> item("fast", 300));

        long t0 = System.nanoTime();
        Optional<ContentItem> r = new StrategyRace(pool, List.of(slow, fast)).race(URL, new byte[0]);

        assertThat(r).isPresent();
        assertThat(r.get().getTitle()).isEqualTo("fast");
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0)).isLessThan(5_000);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void short_results_do_not_qualify() {
        Optional<ContentItem> r = new StrategyRace(pool, List.of(
                strategy("a", () -> item("a", 150)),
                strategy("b", () -> item("b", StrategyRace.QUALIFYING_CHARS)),
                strategy("c", Optional::empty)))
                .race(URL, new byte[0]);
        assertThat(r).isEmpty();
    }

    @Test
    void throwing_strategy_does_not_spoil_the_race() {
        Optional<ContentItem> r = new StrategyRace(pool, List.of(
                strategy("bad", () -> { throw new IllegalStateException("bug"); }),
                strategy("good", () -> item("good", 400))))
                .race(URL, new byte[0]);
        assertThat(r).map(ContentItem::getTitle).contains("good");
    }

    @Test
    void qualification_uses_trimmed_length() {
        ContentItem padded = new ContentItem("t", "   " + "z".repeat(200) + "   ", null, URL);
        assertThat(StrategyRace.qualifies(padded)).isFalse();
        assertThat(StrategyRace.qualifies(padded.withContent("z".repeat(201)))).isTrue();
    }
}
