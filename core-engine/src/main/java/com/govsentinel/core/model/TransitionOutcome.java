package com.govsentinel.core.model;

/**
 * Result of classifying a status transition.
 *
 * @since 1.0.0
 */
public enum TransitionOutcome {

    /** Nothing to send. The caller still persists any status delta. */
    NO_OP,

    /** First announcement; opens a new thread. */
    NOTIFY_INITIAL,

    /** Secondary active state (extended, passed); threaded follow-up. */
    NOTIFY_UPDATE,

    /** Entity reached a terminal status; threaded follow-up, then removal. */
    NOTIFY_TERMINAL,

    /** One-shot warning about an invalid watch target. */
    NOTIFY_ADMIN;

    /**
     * @return {@code true} if this outcome results in a send
     */
    public boolean isActionable() {
        return this != NO_OP;
    }

    /**
     * @return {@code true} if the notification replies to an existing thread
     */
    public boolean isFollowUp() {
        return this == NOTIFY_UPDATE || this == NOTIFY_TERMINAL;
    }
}
