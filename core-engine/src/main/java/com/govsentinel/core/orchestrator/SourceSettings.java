package com.govsentinel.core.orchestrator;

import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.config.SourceDefinition;
import com.govsentinel.core.ratelimit.RateLimiter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable per-source runtime settings handed to a
 * {@link SourceOrchestrator} at construction.
 *
 * @since 1.0.0
 */
public final class SourceSettings {

    private final String name;
    private final String family;
    private final List<ScopeDefinition> scopes;
    private final Duration minRequestInterval;
    private final Duration initialBackoff;
    private final int maxRetries;
    private final Duration pollInterval;
    private final Duration fetchTimeout;
    private final Duration sendTimeout;
    private final boolean continuous;
    private final boolean recheckTracked;

    private SourceSettings(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.family = Objects.requireNonNull(b.family, "family must not be null");
        this.scopes = List.copyOf(b.scopes);
        this.minRequestInterval = b.minRequestInterval;
        this.initialBackoff = b.initialBackoff;
        this.maxRetries = b.maxRetries;
        this.pollInterval = b.pollInterval;
        this.fetchTimeout = b.fetchTimeout;
        this.sendTimeout = b.sendTimeout;
        this.continuous = b.continuous;
        this.recheckTracked = b.recheckTracked;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param definition validated source definition
     * @return settings mirroring the definition
     */
    public static SourceSettings from(SourceDefinition definition) {
        return builder()
                .name(definition.getName())
                .family(definition.getFamily())
                .scopes(definition.getScopes())
                .minRequestInterval(Duration.ofMillis(definition.getMinRequestIntervalMillis()))
                .initialBackoff(Duration.ofMillis(definition.getInitialBackoffMillis()))
                .maxRetries(definition.getMaxRetries())
                .pollInterval(Duration.ofSeconds(definition.getPollIntervalSeconds()))
                .fetchTimeout(Duration.ofSeconds(definition.getFetchTimeoutSeconds()))
                .sendTimeout(Duration.ofSeconds(definition.getSendTimeoutSeconds()))
                .continuous(definition.isContinuous())
                .recheckTracked(definition.isRecheckTracked())
                .build();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String name;
        private String family;
        private final List<ScopeDefinition> scopes = new ArrayList<>();
        private Duration minRequestInterval = RateLimiter.DEFAULT_MIN_INTERVAL;
        private Duration initialBackoff = RateLimiter.DEFAULT_INITIAL_BACKOFF;
        private int maxRetries = RateLimiter.DEFAULT_MAX_RETRIES;
        private Duration pollInterval = Duration.ofSeconds(60);
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private Duration sendTimeout = Duration.ofSeconds(30);
        private boolean continuous = true;
        private boolean recheckTracked = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder family(String family) {
            this.family = family;
            return this;
        }

        public Builder scopes(List<ScopeDefinition> scopes) {
            this.scopes.clear();
            this.scopes.addAll(scopes);
            return this;
        }

        public Builder scope(ScopeDefinition scope) {
            this.scopes.add(scope);
            return this;
        }

        public Builder minRequestInterval(Duration minRequestInterval) {
            this.minRequestInterval = minRequestInterval;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        public Builder continuous(boolean continuous) {
            this.continuous = continuous;
            return this;
        }

        public Builder recheckTracked(boolean recheckTracked) {
            this.recheckTracked = recheckTracked;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a duration is negative, a
         *                                  timeout is not positive or there
         *                                  are no scopes
         */
        public SourceSettings build() {
            Objects.requireNonNull(minRequestInterval, "minRequestInterval must not be null");
            Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
            Objects.requireNonNull(pollInterval, "pollInterval must not be null");
            Objects.requireNonNull(fetchTimeout, "fetchTimeout must not be null");
            Objects.requireNonNull(sendTimeout, "sendTimeout must not be null");
            if (scopes.isEmpty()) {
                throw new IllegalArgumentException("Source '" + name + "' has no scopes");
            }
            if (pollInterval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must be >= 0");
            }
            if (fetchTimeout.isNegative() || fetchTimeout.isZero()
                    || sendTimeout.isNegative() || sendTimeout.isZero()) {
                throw new IllegalArgumentException("timeouts must be > 0");
            }
            return new SourceSettings(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public String getFamily() {
        return family;
    }

    public List<ScopeDefinition> getScopes() {
        return scopes;
    }

    public Duration getMinRequestInterval() {
        return minRequestInterval;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public boolean isContinuous() {
        return continuous;
    }

    public boolean isRecheckTracked() {
        return recheckTracked;
    }

    @Override
    public String toString() {
        return "SourceSettings{" +
                "name='" + name + '\'' +
                ", family='" + family + '\'' +
                ", scopes=" + scopes.size() +
                ", pollInterval=" + pollInterval +
                ", continuous=" + continuous +
                ", recheckTracked=" + recheckTracked +
                '}';
    }
}
