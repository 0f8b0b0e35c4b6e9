package com.govsentinel.core.dispatch;

import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.TransitionOutcome;
import com.govsentinel.core.model.WatchedEntity;

/**
 * Builds transport-neutral payloads. The dispatcher sets the anchor hint and
 * channel afterwards.
 *
 * @since 1.0.0
 */
public interface NotificationFormatter {

    /**
     * @param kind   {@code NOTIFY_INITIAL}, {@code NOTIFY_UPDATE} or
     *               {@code NOTIFY_TERMINAL}
     * @param scope  scope the entity belongs to
     * @param entity current entity state
     * @return notification without anchor or channel
     */
    Notification formatEntity(TransitionOutcome kind, ScopeDefinition scope, WatchedEntity entity);

    /**
     * @param scope  the unresolvable watch target
     * @param source owning source name
     * @return admin notification without channel
     */
    Notification formatAdmin(ScopeDefinition scope, String source);
}
