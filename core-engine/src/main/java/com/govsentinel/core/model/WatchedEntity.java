package com.govsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A governance entity (proposal, poll, executive vote, amendment) as reported
 * by a fetcher on the current pass.
 *
 * <p>
 * Instances are ephemeral: they are produced by a
 * {@link com.govsentinel.core.orchestrator.Fetcher}, classified, dispatched
 * and then discarded. Only the status label is compared by the core; every
 * other field is display data.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id} and {@code status} are required;
 * omitting either throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class WatchedEntity {

    /** Identifier, unique within its scope. */
    private final String id;

    /** Source-defined status label (e.g. {@code active}, {@code closed}). */
    private final String status;

    private final String title;

    /** Canonical URL of the entity, used as the notification action link. */
    private final String url;

    /** Opaque numeric attributes such as support percentage. */
    private final Map<String, Double> attributes;

    private WatchedEntity(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.title = builder.title;
        this.url = builder.url;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for an entity with only an id and a status.
     *
     * @param id     entity identifier
     * @param status status label
     * @return a new entity
     */
    public static WatchedEntity of(String id, String status) {
        return builder().id(id).status(status).build();
    }

    /**
     * Fluent builder for {@link WatchedEntity}.
     */
    public static class Builder {
        private String id;
        private String status;
        private String title;
        private String url;
        private final Map<String, Double> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder attribute(String name, double value) {
            this.attributes.put(Objects.requireNonNull(name, "attribute name must not be null"), value);
            return this;
        }

        public WatchedEntity build() {
            return new WatchedEntity(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getStatus() {
        return status;
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    /**
     * @return unmodifiable view of the numeric attributes
     */
    public Map<String, Double> getAttributes() {
        return attributes;
    }

    public Optional<Double> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WatchedEntity that))
            return false;
        return id.equals(that.id)
                && status.equals(that.status)
                && Objects.equals(title, that.title)
                && Objects.equals(url, that.url)
                && attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, status, title, url, attributes);
    }

    @Override
    public String toString() {
        return "WatchedEntity{" +
                "id='" + id + '\'' +
                ", status='" + status + '\'' +
                ", title='" + title + '\'' +
                '}';
    }
}
