package com.govsentinel.core.ratelimit;

/**
 * Thrown by fetchers and notifiers when the upstream answers with HTTP 429 or
 * an equivalent "Too Many Requests" signal.
 *
 * @since 1.0.0
 */
public class RateLimitedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
