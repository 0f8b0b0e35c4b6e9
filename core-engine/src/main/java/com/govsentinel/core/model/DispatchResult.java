package com.govsentinel.core.model;

import java.util.Optional;

/**
 * What {@link com.govsentinel.core.dispatch.AlertDispatcher#dispatch} did.
 *
 * <p>
 * {@code record} is the entity's state after the call, or empty when the
 * record was removed (successful terminal notification) or never involved
 * (admin alerts, untracked no-ops).
 * </p>
 *
 * @since 1.0.0
 */
public final class DispatchResult {

    private final boolean sent;
    private final EntityRecord record;

    private DispatchResult(boolean sent, EntityRecord record) {
        this.sent = sent;
        this.record = record;
    }

    public static DispatchResult sent(EntityRecord record) {
        return new DispatchResult(true, record);
    }

    public static DispatchResult notSent(EntityRecord record) {
        return new DispatchResult(false, record);
    }

    public boolean isSent() {
        return sent;
    }

    public Optional<EntityRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    @Override
    public String toString() {
        return "DispatchResult{sent=" + sent + ", record=" + record + '}';
    }
}
