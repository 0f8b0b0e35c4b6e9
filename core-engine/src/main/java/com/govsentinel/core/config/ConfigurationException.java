package com.govsentinel.core.config;

/**
 * Unrecoverable configuration problem (missing credentials, unknown policy
 * family, unroutable channel).
 *
 * <p>
 * Fatal for the source it concerns only: the supervisor does not restart an
 * orchestrator that failed with this exception, other sources keep running.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
