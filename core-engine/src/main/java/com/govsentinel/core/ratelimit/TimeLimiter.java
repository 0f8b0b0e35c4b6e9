package com.govsentinel.core.ratelimit;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a blocking upstream call under an explicit deadline.
 *
 * <p>
 * A call that overruns is cancelled (its worker thread interrupted) and
 * reported as {@link TimeoutException}. Runtime exceptions thrown by the call
 * are rethrown unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeLimiter implements AutoCloseable {

    private final ExecutorService executor;

    public TimeLimiter(String threadPrefix) {
        Objects.requireNonNull(threadPrefix, "threadPrefix must not be null");
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, threadPrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param call    the upstream call
     * @param timeout deadline; must be positive
     * @return the call's result
     * @throws TimeoutException     if the deadline passed
     * @throws InterruptedException if the caller was interrupted while waiting
     */
    public <T> T call(Supplier<T> call, Duration timeout) throws TimeoutException, InterruptedException {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0, got: " + timeout);
        }

        Future<T> future = executor.submit(call::get);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Upstream call failed", cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
