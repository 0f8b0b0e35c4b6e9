package com.govsentinel.core.model;

import java.util.Objects;

/**
 * Composite store key {@code scope + ":" + entityId}.
 *
 * <p>
 * The scope disambiguates sub-sources sharing one store (a chain name, a
 * Snapshot space id, a poll/executive split). Entity ids may themselves
 * contain colons; only the first colon separates the scope.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityKey {

    private static final char SEPARATOR = ':';

    private final String scope;
    private final String entityId;

    private EntityKey(String scope, String entityId) {
        this.scope = scope;
        this.entityId = entityId;
    }

    /**
     * @param scope    sub-source namespace; must not be blank or contain ':'
     * @param entityId entity identifier; must not be blank
     * @return the key
     * @throws IllegalArgumentException if either part is invalid
     */
    public static EntityKey of(String scope, String entityId) {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(entityId, "entityId must not be null");
        if (scope.isBlank() || scope.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("scope must be non-blank and free of ':', got: '" + scope + "'");
        }
        if (entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        return new EntityKey(scope, entityId);
    }

    /**
     * Parse a key previously produced by {@link #asString()}.
     *
     * @param raw the stored key
     * @return the parsed key
     * @throws IllegalArgumentException if {@code raw} has no scope separator
     */
    public static EntityKey parse(String raw) {
        Objects.requireNonNull(raw, "key must not be null");
        int idx = raw.indexOf(SEPARATOR);
        if (idx <= 0 || idx == raw.length() - 1) {
            throw new IllegalArgumentException("Malformed entity key: '" + raw + "'");
        }
        return of(raw.substring(0, idx), raw.substring(idx + 1));
    }

    public String scope() {
        return scope;
    }

    public String entityId() {
        return entityId;
    }

    public String asString() {
        return scope + SEPARATOR + entityId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityKey that))
            return false;
        return scope.equals(that.scope) && entityId.equals(that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, entityId);
    }

    @Override
    public String toString() {
        return asString();
    }
}
