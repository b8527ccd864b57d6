package com.webharvest.core.render;

import com.webharvest.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 브라우저 객체를 소유하는 단일 스레드.
 * 작업은 직렬로 실행되고, 시간 예산은 대기열에서 기다린 시간이 아니라 실행 시작부터 센다.
 */
final class RenderThread {

    private static final Logger LOG = LoggerFactory.getLogger(RenderThread.class);
    private static final long POLL_MS = 50;

    private final ExecutorService exec;

    RenderThread(String name) {
        this.exec = Executors.newSingleThreadExecutor(new NamedThreadFactory(name));
    }

    <T> T call(String url, Callable<T> task, Duration budget) throws RenderException {
        CountDownLatch started = new CountDownLatch(1);
        Future<T> f;
        try {
            f = exec.submit(() -> {
                started.countDown();
                return task.call();
            });
        } catch (RejectedExecutionException e) {
            throw new RenderException(url, "Renderer is closed", e);
        }

        try {
            // ---- 1) 차례 대기(예산 미포함) ----
            while (!started.await(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (exec.isShutdown()) {
                    f.cancel(false);
                    throw new RenderException(url, "Renderer is closed");
                }
            }
            // ---- 2) 실행 ----
            return f.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new RenderException(url, "Render exceeded " + budget.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new RenderException(url, "Interrupted while rendering", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RenderException re) throw re;
            throw new RenderException(url, "Browser error", cause);
        }
    }

    /** cleanup 을 이 스레드에서 실행한 뒤 종료. 대기 중인 작업은 버린다 */
    void shutdown(Runnable cleanup, Duration wait) {
        try {
            exec.submit(cleanup).get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOG.debug("Render thread already stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Headless browser shutdown incomplete: {}", e.toString());
        } finally {
            exec.shutdownNow();
        }
    }
}
