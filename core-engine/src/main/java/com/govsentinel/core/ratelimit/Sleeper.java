package com.govsentinel.core.ratelimit;

import java.time.Duration;

/**
 * Blocking pause, abstracted so tests can observe waits without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
