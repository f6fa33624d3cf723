package com.blogsmith.core.stage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one collaborator call for a stage, bounded by a timeout.
 * <p>
 * The call runs on a worker thread that inherits the caller's MDC. The caller blocks until
 * the call completes, so stages of a run stay strictly sequential. Any failure, a timeout or
 * a {@code null} result surfaces as {@link ExternalServiceException}; cancellation surfaces as
 * {@link RunCancelledException}. Nothing is retried here.
 * <p>
 * The timeout covers the call itself. Time spent waiting for a free worker does not count.
 */
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private static final long QUEUE_POLL_MS = 50;

    private final ExecutorService workers;
    private final Duration timeout;
    private final RunCancellation cancellation;

    public StageRunner(ExecutorService workers, Duration timeout, RunCancellation cancellation) {
        this.workers = workers;
        this.timeout = timeout;
        this.cancellation = cancellation;
    }

    public <T> T invoke(String stage, Callable<T> call) {
        cancellation.throwIfCancelled(stage);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        var started = new CountDownLatch(1);
        Future<T> future = workers.submit(() -> {
            started.countDown();
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.call();
            } finally {
                MDC.clear();
            }
        });
        cancellation.track(future);

        try {
            awaitStart(future, started);
            long start = System.currentTimeMillis();
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Stage {} call finished in {}ms", stage, System.currentTimeMillis() - start);
            if (result == null) {
                throw new ExternalServiceException(stage, "collaborator returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalServiceException(stage, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (CancellationException e) {
            throw new RunCancelledException(stage, String.valueOf(cancellation.reason()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new RunCancelledException(stage, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExternalServiceException(stage, describe(cause), cause);
        } finally {
            cancellation.untrack(future);
        }
    }

    /**
     * Blocks until a worker picks the call up. Returns early if the future was cancelled while
     * queued; {@code get} then reports it.
     */
    private void awaitStart(Future<?> future, CountDownLatch started) throws InterruptedException {
        while (!started.await(QUEUE_POLL_MS, TimeUnit.MILLISECONDS)) {
            if (future.isDone()) {
                return;
            }
            if (cancellation.isCancelled()) {
                future.cancel(true);
                return;
            }
        }
    }

    public Duration timeout() {
        return timeout;
    }

    public RunCancellation cancellation() {
        return cancellation;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
