package com.govsentinel.core.store;

import com.govsentinel.core.model.EntityKey;
import com.govsentinel.core.model.EntityRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Durable map from {@link EntityKey} to last-observed {@link EntityRecord}.
 *
 * <p>
 * One store per governance source. Every mutation is persisted before the
 * method returns; a persistence failure is logged and the in-memory state
 * stays authoritative for the running process.
 * </p>
 *
 * <p>
 * Implementations are used by a single orchestrator thread and need not be
 * safe for concurrent writers, but {@link #all()} must return a consistent
 * snapshot.
 * </p>
 */
public interface EntityStore {

    Optional<EntityRecord> get(EntityKey key);

    /**
     * Merge into the record for {@code key}, creating it if absent.
     *
     * @param key          entity key
     * @param status       new status label; must not be {@code null}
     * @param threadAnchor new anchor, or {@code null} to keep the existing one
     * @param notified     new flag, or {@code null} to keep the existing one
     *                     ({@code false} for a new record)
     * @return the record as stored
     */
    EntityRecord upsert(EntityKey key, String status, String threadAnchor, Boolean notified);

    /**
     * @param key entity key
     * @return {@code true} if a record was removed
     */
    boolean remove(EntityKey key);

    int count();

    /**
     * @return immutable snapshot of every record, keyed by entity key
     */
    Map<EntityKey, EntityRecord> all();
}
