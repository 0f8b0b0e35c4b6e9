package com.govsentinel.core.orchestrator;

/**
 * Upstream fetch failure: transport error, bad response, timeout or
 * exhausted rate-limit retries. Skips the affected scope for one pass.
 *
 * @since 1.0.0
 */
public class FetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
