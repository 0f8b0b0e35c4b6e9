package com.govsentinel.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.function.LongSupplier;

/**
 * Per-source request throttle.
 *
 * <h3>Behaviour</h3>
 * <ul>
 * <li>Single slot: at most one in-flight upstream request per source.</li>
 * <li>Minimum spacing: {@link #acquire()} waits until {@code minInterval}
 * has elapsed since the previous grant.</li>
 * <li>Backoff: each consecutive rate-limit signal reported through
 * {@link #onRateLimitError()} sleeps
 * {@code initialBackoff * 2^(failures-1)}; once failures exceed
 * {@code maxRetries} the call returns {@code false} and the caller skips the
 * operation for this cycle.</li>
 * </ul>
 *
 * <p>
 * Upstream governance APIs do not tolerate bursts, so there is deliberately
 * no way to widen the slot.
 * </p>
 *
 * @since 1.0.0
 */
public class RateLimiter {

    private static final Logger LOG = LoggerFactory.getLogger(RateLimiter.class);

    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final String name;
    private final Duration minInterval;
    private final Duration initialBackoff;
    private final int maxRetries;
    private final Sleeper sleeper;
    private final LongSupplier nanoClock;

    private final Semaphore slot = new Semaphore(1, true);

    /** Guarded by {@code slot}. */
    private long lastGrantNanos;
    private boolean granted;

    private int consecutiveFailures;

    public RateLimiter(String name, Duration minInterval, Duration initialBackoff, int maxRetries) {
        this(name, minInterval, initialBackoff, maxRetries, Sleeper.SYSTEM, System::nanoTime);
    }

    /**
     * @param name           source name, used in log output
     * @param minInterval    minimum spacing between grants; zero disables
     * @param initialBackoff first backoff window
     * @param maxRetries     number of backoffs allowed before giving up
     * @param sleeper        pause implementation
     * @param nanoClock      monotonic clock in nanoseconds
     * @throws IllegalArgumentException if a duration is negative or
     *                                  {@code maxRetries < 0}
     */
    public RateLimiter(String name, Duration minInterval, Duration initialBackoff, int maxRetries,
            Sleeper sleeper, LongSupplier nanoClock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.minInterval = Objects.requireNonNull(minInterval, "minInterval must not be null");
        this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.maxRetries = maxRetries;

        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must be >= 0 for '" + name + "', got: " + minInterval);
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException(
                    "initialBackoff must be >= 0 for '" + name + "', got: " + initialBackoff);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for '" + name + "', got: " + maxRetries);
        }
    }

    /**
     * Block until one upstream request may be issued. Every successful call
     * must be paired with {@link #release()}.
     *
     * @throws InterruptedException if interrupted while waiting; the slot is
     *                              not held in that case
     */
    public void acquire() throws InterruptedException {
        slot.acquire();
        try {
            if (granted) {
                long elapsed = nanoClock.getAsLong() - lastGrantNanos;
                long remaining = minInterval.toNanos() - elapsed;
                if (remaining > 0) {
                    LOG.debug("[{}] spacing requests, waiting {} ms", name, remaining / 1_000_000);
                    sleeper.sleep(Duration.ofNanos(remaining));
                }
            }
        } catch (InterruptedException e) {
            slot.release();
            throw e;
        }
        lastGrantNanos = nanoClock.getAsLong();
        granted = true;
    }

    /**
     * Return the slot taken by {@link #acquire()}.
     */
    public void release() {
        slot.release();
    }

    /**
     * Record a rate-limit signal and back off.
     *
     * @return {@code true} if the caller may retry, {@code false} once the
     *         retry budget is exhausted (the counter then starts over)
     * @throws InterruptedException if interrupted during the backoff
     */
    public synchronized boolean onRateLimitError() throws InterruptedException {
        consecutiveFailures++;
        if (consecutiveFailures > maxRetries) {
            LOG.warn("[{}] max retries ({}) exceeded for rate limit errors, skipping", name, maxRetries);
            consecutiveFailures = 0;
            return false;
        }
        Duration backoff = backoffFor(consecutiveFailures);
        LOG.warn("[{}] rate limited, backing off for {} ms (attempt {}/{})",
                name, backoff.toMillis(), consecutiveFailures, maxRetries);
        sleeper.sleep(backoff);
        return true;
    }

    /**
     * Clear the consecutive-failure counter after a request went through.
     */
    public synchronized void onSuccess() {
        consecutiveFailures = 0;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    Duration backoffFor(int failures) {
        return initialBackoff.multipliedBy(1L << Math.min(failures - 1, 30));
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
