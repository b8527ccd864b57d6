package com.webharvest.core.render;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderThreadTest {

    private final RenderThread thread = new RenderThread("render-test");
    private final ExecutorService callers = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
        thread.shutdown(() -> {}, Duration.ofSeconds(1));
        callers.shutdownNow();
    }

    @Test
    @DisplayName("대기열에서 기다린 시간은 렌더 예산에 들어가지 않는다")
    void queued_calls_each_get_their_full_budget() throws Exception {
        Duration budget = Duration.ofMillis(1000);
        List<Future<String>> calls = new ArrayList<>();
        for (String name : List.of("a", "b", "c")) {
            calls.add(callers.submit(() -> thread.call(name, () -> {
                Thread.sleep(600);
                return name;
            }, budget)));
        }

        List<String> done = new ArrayList<>();
        for (Future<String> f : calls) done.add(f.get(10, TimeUnit.SECONDS));

        // 합계 1.8s > 예산 1s 이지만 각 작업은 0.6s
        assertThat(done).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    void overrunning_task_fails_only_itself() throws Exception {
        assertThatThrownBy(() -> thread.call("https://slow.example/", () -> {
            Thread.sleep(5000);
            return "late";
        }, Duration.ofMillis(200)))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("Render exceeded 200ms")
                .hasMessageContaining("https://slow.example/");

        // 취소된 작업 뒤에도 스레드는 계속 쓸 수 있다
        assertThat(thread.call("next", () -> "ok", Duration.ofSeconds(2))).isEqualTo("ok");
    }

    @Test
    void render_exception_from_task_is_passed_through() {
        RenderException boom = new RenderException("https://a.example/", "Failed to render");
        assertThatThrownBy(() -> thread.call("https://a.example/", () -> { throw boom; }, Duration.ofSeconds(2)))
                .isSameAs(boom);
        assertThatThrownBy(() -> thread.call("https://b.example/", () -> { throw new IllegalStateException("x"); },
                Duration.ofSeconds(2)))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("Browser error");
    }

    @Test
    void calls_after_shutdown_are_rejected() {
        thread.shutdown(() -> {}, Duration.ofSeconds(1));
        assertThatThrownBy(() -> thread.call("https://a.example/", () -> "x", Duration.ofSeconds(1)))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("Renderer is closed");
    }
}
