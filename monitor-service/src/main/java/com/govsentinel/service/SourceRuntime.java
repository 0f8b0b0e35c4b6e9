package com.govsentinel.service;

import com.govsentinel.core.orchestrator.SourceOrchestrator;
import com.govsentinel.core.ratelimit.TimeLimiter;

import java.time.Duration;
import java.util.Objects;

/**
 * An assembled source: its orchestrator plus the resources it owns.
 *
 * @since 1.0.0
 */
public final class SourceRuntime implements AutoCloseable {

    private final SourceOrchestrator orchestrator;
    private final TimeLimiter timeLimiter;
    private final Duration restartDelay;

    public SourceRuntime(SourceOrchestrator orchestrator, TimeLimiter timeLimiter, Duration restartDelay) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.timeLimiter = timeLimiter;
        this.restartDelay = Objects.requireNonNull(restartDelay, "restartDelay must not be null");
    }

    public String getName() {
        return orchestrator.getName();
    }

    public SourceOrchestrator getOrchestrator() {
        return orchestrator;
    }

    /**
     * @return wait before restarting after an unexpected crash
     */
    public Duration getRestartDelay() {
        return restartDelay;
    }

    @Override
    public void close() {
        if (timeLimiter != null) {
            timeLimiter.close();
        }
    }
}
