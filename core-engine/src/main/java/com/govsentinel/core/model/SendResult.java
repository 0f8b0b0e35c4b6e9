package com.govsentinel.core.model;

import java.util.Optional;

/**
 * Outcome of one notifier call.
 *
 * @since 1.0.0
 */
public final class SendResult {

    private static final SendResult FAILED = new SendResult(false, null);

    private final boolean ok;
    private final String anchor;

    private SendResult(boolean ok, String anchor) {
        this.ok = ok;
        this.anchor = anchor;
    }

    /**
     * @param anchor reference to the posted message; may be {@code null} for
     *               anchor-less transports
     * @return a successful result
     */
    public static SendResult delivered(String anchor) {
        return new SendResult(true, anchor);
    }

    public static SendResult failed() {
        return FAILED;
    }

    public boolean isOk() {
        return ok;
    }

    public Optional<String> getAnchor() {
        return Optional.ofNullable(anchor);
    }

    @Override
    public String toString() {
        return ok ? "SendResult{ok, anchor='" + anchor + "'}" : "SendResult{failed}";
    }
}
