package com.govsentinel.core.orchestrator;

import com.govsentinel.core.config.ConfigurationException;
import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.dispatch.AlertDispatcher;
import com.govsentinel.core.model.DispatchResult;
import com.govsentinel.core.model.EntityKey;
import com.govsentinel.core.model.EntityRecord;
import com.govsentinel.core.model.TransitionOutcome;
import com.govsentinel.core.model.WatchedEntity;
import com.govsentinel.core.policy.TransitionPolicy;
import com.govsentinel.core.ratelimit.RateLimitedException;
import com.govsentinel.core.ratelimit.RateLimiter;
import com.govsentinel.core.ratelimit.Sleeper;
import com.govsentinel.core.ratelimit.TimeLimiter;
import com.govsentinel.core.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Drives the poll / diff / dispatch cycle for one governance source.
 *
 * <h3>One pass</h3>
 * <ol>
 * <li>For each scope: fetch the batch under the rate limiter and the fetch
 * timeout.</li>
 * <li>{@code null} batch: the scope no longer resolves; send the one-shot
 * admin alert.</li>
 * <li>Otherwise classify and dispatch every entity, then re-check notified
 * entities that dropped out of the batch through
 * {@link Fetcher#fetchTracked}.</li>
 * </ol>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * A failing scope is logged and skipped; a failing entity is logged and the
 * rest of the batch still runs. Only {@link ConfigurationException} escapes,
 * from {@link #run()}, and ends this orchestrator.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * Passes run on the caller's thread; entities are processed sequentially, so
 * the store sees a single writer. {@link #requestStop()} takes effect after
 * the current pass.
 * </p>
 *
 * @since 1.0.0
 */
public class SourceOrchestrator implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SourceOrchestrator.class);

    private final SourceSettings settings;
    private final Fetcher fetcher;
    private final TransitionPolicy policy;
    private final EntityStore store;
    private final AlertDispatcher dispatcher;
    private final RateLimiter limiter;
    private final TimeLimiter timeLimiter;
    private final Sleeper sleeper;

    private volatile OrchestratorState state = OrchestratorState.IDLE;
    private volatile boolean stopRequested;
    private volatile PassReport lastReport;
    private volatile Instant lastPassAt;
    private final AtomicLong passes = new AtomicLong();

    private SourceOrchestrator(Builder b) {
        this.settings = Objects.requireNonNull(b.settings, "settings must not be null");
        this.fetcher = Objects.requireNonNull(b.fetcher, "fetcher must not be null");
        this.policy = Objects.requireNonNull(b.policy, "policy must not be null");
        this.store = Objects.requireNonNull(b.store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher must not be null");
        this.timeLimiter = Objects.requireNonNull(b.timeLimiter, "timeLimiter must not be null");
        this.sleeper = b.sleeper != null ? b.sleeper : Sleeper.SYSTEM;
        this.limiter = b.limiter != null ? b.limiter
                : new RateLimiter(settings.getName(), settings.getMinRequestInterval(),
                        settings.getInitialBackoff(), settings.getMaxRetries(), sleeper, System::nanoTime);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Run passes until stopped (continuous mode) or once (single-pass mode).
     *
     * @throws ConfigurationException if a scope cannot be routed or a pass
     *                                hits a configuration error
     */
    @Override
    public void run() {
        LOG.info("[{}] Orchestrator starting: {}", settings.getName(), settings);
        try {
            dispatcher.verifyRouting(settings.getScopes());
            while (!stopRequested) {
                try {
                    PassReport report = runPass();
                    if (report.isInterrupted()) {
                        break;
                    }
                } catch (ConfigurationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    LOG.error("[{}] Pass failed, will retry after the poll interval", settings.getName(), e);
                }
                if (!settings.isContinuous() || stopRequested) {
                    break;
                }
                state = OrchestratorState.SLEEPING;
                sleeper.sleep(settings.getPollInterval());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("[{}] Orchestrator interrupted", settings.getName());
        } finally {
            state = OrchestratorState.STOPPED;
            LOG.info("[{}] Orchestrator stopped after {} pass(es)", settings.getName(), passes.get());
        }
    }

    /**
     * Ask the orchestrator to stop once the current pass completes.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public OrchestratorState state() {
        return state;
    }

    public Optional<PassReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    public Optional<Instant> lastPassAt() {
        return Optional.ofNullable(lastPassAt);
    }

    public long passCount() {
        return passes.get();
    }

    public String getName() {
        return settings.getName();
    }

    // ---------------------------------------------------------------
    // One pass
    // ---------------------------------------------------------------

    /**
     * Reconcile every scope once.
     *
     * @return counters for this pass
     */
    public PassReport runPass() {
        PassReport report = new PassReport();
        for (ScopeDefinition scope : settings.getScopes()) {
            try {
                reconcileScope(scope, report);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("[{}] Pass interrupted at scope '{}'", settings.getName(), scope.getId());
                report.markInterrupted();
                break;
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                report.scopeFailed();
                LOG.error("[{}] Skipping scope '{}' this pass: {}", settings.getName(), scope.getId(),
                        e.getMessage(), e);
            }
        }
        state = OrchestratorState.IDLE;
        passes.incrementAndGet();
        lastReport = report;
        lastPassAt = Instant.now();
        LOG.info("[{}] Pass complete: {} (tracked={})", settings.getName(), report, store.count());
        return report;
    }

    private void reconcileScope(ScopeDefinition scope, PassReport report) throws InterruptedException {
        state = OrchestratorState.FETCHING;
        List<WatchedEntity> batch = guardedFetch("batch for '" + scope.getId() + "'",
                () -> fetcher.fetchBatch(scope.getId()));

        state = OrchestratorState.RECONCILING;
        if (batch == null) {
            report.scopeInvalid();
            TransitionOutcome outcome = policy.classifyScopeProbe(false, dispatcher.isWarned(scope));
            if (outcome == TransitionOutcome.NOTIFY_ADMIN) {
                tally(report, dispatcher.dispatchAdmin(scope));
            } else {
                LOG.debug("[{}] Scope '{}' still unresolved, already warned", settings.getName(), scope.getId());
            }
            return;
        }

        LOG.debug("[{}] Scope '{}' returned {} entity(ies)", settings.getName(), scope.getId(), batch.size());
        Set<String> seen = new HashSet<>();
        for (WatchedEntity entity : batch) {
            seen.add(entity.getId());
            reconcileEntity(scope, entity, report);
        }

        if (settings.isRecheckTracked()) {
            recheckTracked(scope, seen, report);
        }
    }

    private void reconcileEntity(ScopeDefinition scope, WatchedEntity entity, PassReport report) {
        report.entitySeen();
        try {
            EntityKey key = EntityKey.of(scope.getId(), entity.getId());
            EntityRecord record = store.get(key).orElse(null);
            TransitionOutcome outcome = policy.classifyRecord(record, entity.getStatus());
            DispatchResult result = dispatcher.dispatch(scope, entity, record, outcome);
            if (outcome.isActionable()) {
                tally(report, result.isSent());
            }
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            report.entityError();
            LOG.error("[{}] Failed to reconcile entity '{}' in scope '{}'", settings.getName(), entity.getId(),
                    scope.getId(), e);
        }
    }

    /**
     * Re-fetch notified entities of this scope that are missing from the
     * batch (e.g. a proposal that left the "active" listing). Unknown results
     * leave the record untouched.
     */
    private void recheckTracked(ScopeDefinition scope, Set<String> seen, PassReport report)
            throws InterruptedException {
        List<String> missing = new ArrayList<>();
        for (Map.Entry<EntityKey, EntityRecord> entry : store.all().entrySet()) {
            EntityKey key = entry.getKey();
            if (key.scope().equals(scope.getId())
                    && entry.getValue().isNotified()
                    && !seen.contains(key.entityId())) {
                missing.add(key.entityId());
            }
        }

        for (String entityId : missing) {
            try {
                Optional<WatchedEntity> current = guardedFetch("tracked entity '" + entityId + "'",
                        () -> fetcher.fetchTracked(scope.getId(), entityId));
                if (current != null && current.isPresent()) {
                    report.recheckedEntity();
                    reconcileEntity(scope, current.get(), report);
                }
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                report.entityError();
                LOG.error("[{}] Re-check of '{}' in scope '{}' failed: {}", settings.getName(), entityId,
                        scope.getId(), e.getMessage());
            }
        }
    }

    // ---------------------------------------------------------------
    // Upstream access
    // ---------------------------------------------------------------

    /**
     * One upstream call under the rate limiter and fetch timeout, retried with
     * backoff while the upstream reports throttling.
     *
     * @throws FetchException once the retry budget is spent or the call
     *                        times out
     */
    private <T> T guardedFetch(String what, Supplier<T> call) throws InterruptedException {
        while (true) {
            limiter.acquire();
            try {
                T result = timeLimiter.call(call, settings.getFetchTimeout());
                limiter.onSuccess();
                return result;
            } catch (RateLimitedException e) {
                LOG.warn("[{}] Rate limited fetching {}: {}", settings.getName(), what, e.getMessage());
            } catch (TimeoutException e) {
                throw new FetchException("Fetching " + what + " timed out after " + settings.getFetchTimeout(), e);
            } finally {
                limiter.release();
            }

            if (!limiter.onRateLimitError()) {
                throw new FetchException("Fetching " + what + " still rate limited after "
                        + limiter.getMaxRetries() + " retries");
            }
        }
    }

    private static void tally(PassReport report, boolean sent) {
        if (sent) {
            report.notificationSent();
        } else {
            report.sendFailed();
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private SourceSettings settings;
        private Fetcher fetcher;
        private TransitionPolicy policy;
        private EntityStore store;
        private AlertDispatcher dispatcher;
        private RateLimiter limiter;
        private TimeLimiter timeLimiter;
        private Sleeper sleeper;

        public Builder settings(SourceSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder fetcher(Fetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder policy(TransitionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder store(EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder dispatcher(AlertDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * Optional; defaults to a limiter built from the settings.
         */
        public Builder limiter(RateLimiter limiter) {
            this.limiter = limiter;
            return this;
        }

        public Builder timeLimiter(TimeLimiter timeLimiter) {
            this.timeLimiter = timeLimiter;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public SourceOrchestrator build() {
            return new SourceOrchestrator(this);
        }
    }
}
