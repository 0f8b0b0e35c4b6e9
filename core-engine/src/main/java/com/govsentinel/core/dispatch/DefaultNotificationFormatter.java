package com.govsentinel.core.dispatch;

import com.govsentinel.core.config.ScopeDefinition;
import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.TransitionOutcome;
import com.govsentinel.core.model.WatchedEntity;

import java.util.Objects;

/**
 * Formatter shared by every source family.
 *
 * <p>
 * Titles read {@code "<scope> Proposal Active|Update|Ended"}; the body is the
 * entity title; the action link is the entity URL, or the scope's link base
 * followed by {@code /proposal/<id>}.
 * </p>
 *
 * @since 1.0.0
 */
public class DefaultNotificationFormatter implements NotificationFormatter {

    @Override
    public Notification formatEntity(TransitionOutcome kind, ScopeDefinition scope, WatchedEntity entity) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(entity, "entity must not be null");

        String suffix = switch (kind) {
            case NOTIFY_INITIAL -> "Proposal Active";
            case NOTIFY_UPDATE -> "Proposal Update";
            case NOTIFY_TERMINAL -> "Proposal Ended";
            default -> throw new IllegalArgumentException("Not an entity notification: " + kind);
        };
        String buttonText = kind == TransitionOutcome.NOTIFY_TERMINAL ? "View Results" : "View Proposal";

        return Notification.builder()
                .kind(kind)
                .title(scope.displayNameOrId() + " " + suffix)
                .body(entity.getTitle().orElse(entity.getId()))
                .actionLink(linkFor(scope, entity))
                .actionText(buttonText)
                .build();
    }

    @Override
    public Notification formatAdmin(ScopeDefinition scope, String source) {
        return Notification.builder()
                .kind(TransitionOutcome.NOTIFY_ADMIN)
                .title("Watch Target Not Found")
                .body("Configured " + source + " scope '" + scope.getId()
                        + "' (" + scope.displayNameOrId() + ") no longer resolves upstream. "
                        + "Please review the watchlist.")
                .build();
    }

    private static String linkFor(ScopeDefinition scope, WatchedEntity entity) {
        if (entity.getUrl().isPresent()) {
            return entity.getUrl().get();
        }
        String base = scope.getActionLinkBase();
        if (base == null || base.isBlank()) {
            return null;
        }
        return (base.endsWith("/") ? base.substring(0, base.length() - 1) : base) + "/proposal/" + entity.getId();
    }
}
