package com.govsentinel.core.dispatch;

import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.model.DispatchResult;
import com.govsentinel.core.model.EntityKey;
import com.govsentinel.core.model.EntityRecord;
import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.SendResult;
import com.govsentinel.core.model.TransitionOutcome;
import com.govsentinel.core.model.WatchedEntity;
import com.govsentinel.core.policy.TransitionPolicy;
import com.govsentinel.core.ratelimit.TimeLimiter;
import com.govsentinel.core.store.AdminAlertRegistry;
import com.govsentinel.core.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Turns a {@link TransitionOutcome} into a send and writes the outcome back to
 * the {@link EntityStore}.
 *
 * <h3>Store effects</h3>
 * <table>
 * <caption>Record after dispatch</caption>
 * <tr><th>Outcome</th><th>Send ok</th><th>Send failed</th></tr>
 * <tr><td>NOTIFY_INITIAL</td><td>status, anchor, notified=true</td>
 * <td>status, notified=false</td></tr>
 * <tr><td>NOTIFY_UPDATE</td><td>status, notified=true, anchor kept</td>
 * <td>status only</td></tr>
 * <tr><td>NOTIFY_TERMINAL</td><td>removed</td><td>status only</td></tr>
 * <tr><td>NO_OP</td><td colspan="2">status only, and only if it changed</td></tr>
 * </table>
 *
 * <p>
 * Follow-ups reply to the stored anchor. Without one the message goes out
 * standalone with {@link #MISSING_CONTEXT_PREFIX} prepended to the body.
 * A notifier that throws or overruns the send timeout counts as a failed
 * send; nothing escapes {@link #dispatch}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDispatcher.class);

    public static final String MISSING_CONTEXT_PREFIX = "⚠️ Unable to find original message context. ";

    private final String source;
    private final EntityStore store;
    private final AdminAlertRegistry adminAlerts;
    private final Notifier notifier;
    private final NotificationFormatter formatter;
    private final ChannelRouter router;
    private final TimeLimiter timeLimiter;
    private final Duration sendTimeout;

    private AlertDispatcher(Builder b) {
        this.source = Objects.requireNonNull(b.source, "source must not be null");
        this.store = Objects.requireNonNull(b.store, "store must not be null");
        this.adminAlerts = Objects.requireNonNull(b.adminAlerts, "adminAlerts must not be null");
        this.notifier = Objects.requireNonNull(b.notifier, "notifier must not be null");
        this.formatter = b.formatter != null ? b.formatter : new DefaultNotificationFormatter();
        this.router = Objects.requireNonNull(b.router, "router must not be null");
        this.timeLimiter = Objects.requireNonNull(b.timeLimiter, "timeLimiter must not be null");
        this.sendTimeout = b.sendTimeout != null ? b.sendTimeout : Duration.ofSeconds(30);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Entity lifecycle
    // ---------------------------------------------------------------

    /**
     * @param scope   scope the entity belongs to
     * @param entity  current entity state
     * @param record  stored record, or {@code null} if none
     * @param outcome classification of the transition; not
     *                {@code NOTIFY_ADMIN}
     * @return whether a notification went out and the resulting record
     */
    public DispatchResult dispatch(ScopeDefinition scope, WatchedEntity entity, EntityRecord record,
            TransitionOutcome outcome) {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");

        EntityKey key = EntityKey.of(scope.getId(), entity.getId());
        return switch (outcome) {
            case NO_OP -> trackSilently(key, entity, record);
            case NOTIFY_INITIAL -> sendInitial(key, scope, entity);
            case NOTIFY_UPDATE, NOTIFY_TERMINAL -> sendFollowUp(key, scope, entity, record, outcome);
            case NOTIFY_ADMIN -> throw new IllegalArgumentException(
                    "Admin alerts are scope-level; use dispatchAdmin for " + key);
        };
    }

    private DispatchResult trackSilently(EntityKey key, WatchedEntity entity, EntityRecord record) {
        if (record != null && TransitionPolicy.sameStatus(record.getStatus(), entity.getStatus())) {
            return DispatchResult.notSent(record);
        }
        EntityRecord updated = store.upsert(key, entity.getStatus(), null, null);
        LOG.debug("[{}] Tracking {} silently at status '{}'", source, key, entity.getStatus());
        return DispatchResult.notSent(updated);
    }

    private DispatchResult sendInitial(EntityKey key, ScopeDefinition scope, WatchedEntity entity) {
        Notification notification = formatter.formatEntity(TransitionOutcome.NOTIFY_INITIAL, scope, entity)
                .toBuilder()
                .anchorHint(null)
                .channel(router.resolve(scope))
                .build();

        SendResult result = send(key, notification);
        if (result.isOk()) {
            EntityRecord updated = store.upsert(key, entity.getStatus(), result.getAnchor().orElse(null), true);
            LOG.info("[{}] Initial notification sent for {} (anchor={})", source, key, updated.getThreadAnchor());
            return DispatchResult.sent(updated);
        }
        EntityRecord updated = store.upsert(key, entity.getStatus(), null, false);
        LOG.warn("[{}] Initial notification failed for {}; will retry next pass", source, key);
        return DispatchResult.notSent(updated);
    }

    private DispatchResult sendFollowUp(EntityKey key, ScopeDefinition scope, WatchedEntity entity,
            EntityRecord record, TransitionOutcome outcome) {
        String anchor = record != null ? record.getThreadAnchor() : null;
        Notification formatted = formatter.formatEntity(outcome, scope, entity);
        Notification.Builder builder = formatted.toBuilder()
                .anchorHint(anchor)
                .channel(router.resolve(scope));
        if (anchor == null) {
            LOG.warn("[{}] No thread anchor for {}; sending {} standalone", source, key, outcome);
            builder.body(MISSING_CONTEXT_PREFIX + formatted.getBody());
        }

        SendResult result = send(key, builder.build());
        if (!result.isOk()) {
            EntityRecord updated = store.upsert(key, entity.getStatus(), null, null);
            LOG.warn("[{}] {} failed for {}; keeping thread context for retry", source, outcome, key);
            return DispatchResult.notSent(updated);
        }

        if (outcome == TransitionOutcome.NOTIFY_TERMINAL) {
            store.remove(key);
            LOG.info("[{}] Terminal notification sent for {} ({}); no longer tracked",
                    source, key, entity.getStatus());
            return DispatchResult.sent(null);
        }
        EntityRecord updated = store.upsert(key, entity.getStatus(), null, true);
        LOG.info("[{}] Update notification sent for {} ({})", source, key, entity.getStatus());
        return DispatchResult.sent(updated);
    }

    // ---------------------------------------------------------------
    // Admin alerts
    // ---------------------------------------------------------------

    /**
     * Send a one-shot warning that a configured scope no longer resolves.
     *
     * @param scope the unresolvable scope
     * @return {@code true} if the warning was sent by this call
     */
    public boolean dispatchAdmin(ScopeDefinition scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        String identifier = scope.getId();
        if (adminAlerts.isWarned(identifier)) {
            LOG.debug("[{}] Admin alert for '{}' already sent", source, identifier);
            return false;
        }

        Notification notification = formatter.formatAdmin(scope, source)
                .toBuilder()
                .channel(router.resolve(scope))
                .build();
        SendResult result = send(identifier, notification);
        if (result.isOk()) {
            adminAlerts.markWarned(identifier);
            LOG.warn("[{}] Admin alert sent: scope '{}' not found upstream", source, identifier);
            return true;
        }
        LOG.warn("[{}] Admin alert for '{}' failed; will retry next pass", source, identifier);
        return false;
    }

    public boolean isWarned(ScopeDefinition scope) {
        return adminAlerts.isWarned(scope.getId());
    }

    /**
     * @throws com.govsentinel.core.config.ConfigurationException if a scope
     *                                                             has no
     *                                                             channel
     */
    public void verifyRouting(Iterable<ScopeDefinition> scopes) {
        router.verify(scopes);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SendResult send(Object subject, Notification notification) {
        try {
            SendResult result = timeLimiter.call(() -> notifier.send(notification), sendTimeout);
            return result != null ? result : SendResult.failed();
        } catch (TimeoutException e) {
            LOG.error("[{}] Send for {} timed out after {}", source, subject, sendTimeout);
            return SendResult.failed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("[{}] Send for {} interrupted", source, subject);
            return SendResult.failed();
        } catch (RuntimeException e) {
            LOG.error("[{}] Send for {} failed: {}", source, subject, e.getMessage(), e);
            return SendResult.failed();
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String source;
        private EntityStore store;
        private AdminAlertRegistry adminAlerts;
        private Notifier notifier;
        private NotificationFormatter formatter;
        private ChannelRouter router;
        private TimeLimiter timeLimiter;
        private Duration sendTimeout;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder store(EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder adminAlerts(AdminAlertRegistry adminAlerts) {
            this.adminAlerts = adminAlerts;
            return this;
        }

        public Builder notifier(Notifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder formatter(NotificationFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder router(ChannelRouter router) {
            this.router = router;
            return this;
        }

        public Builder timeLimiter(TimeLimiter timeLimiter) {
            this.timeLimiter = timeLimiter;
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        public AlertDispatcher build() {
            return new AlertDispatcher(this);
        }
    }
}
