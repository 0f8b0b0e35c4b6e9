package com.govsentinel.core.orchestrator;

import com.govsentinel.core.model.WatchedEntity;

import java.util.List;
import java.util.Optional;

/**
 * Upstream client for one governance source.
 *
 * <p>
 * Implementations signal upstream throttling with
 * {@link com.govsentinel.core.ratelimit.RateLimitedException} and any other
 * upstream failure with {@link FetchException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface Fetcher {

    /**
     * @param scope scope id (space, organisation, chain, network)
     * @return current entities; an empty list when the scope is valid but has
     *         nothing to report; {@code null} when the scope does not exist
     */
    List<WatchedEntity> fetchBatch(String scope);

    /**
     * Look up one previously tracked entity that no longer appears in the
     * batch. The default reports it as unknown.
     *
     * @return the entity's current state, or empty if unknown
     */
    default Optional<WatchedEntity> fetchTracked(String scope, String entityId) {
        return Optional.empty();
    }
}
