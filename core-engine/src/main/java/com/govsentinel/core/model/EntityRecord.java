package com.govsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Last-observed state of one watched entity, as persisted by an
 * {@link com.govsentinel.core.store.EntityStore}.
 *
 * <p>
 * Immutable. Each mutation produces a new instance through one of the
 * {@code with*} methods so that a snapshot handed out by the store can never
 * change under the caller.
 * </p>
 *
 * <p>
 * Serialized as {@code {"status": ..., "thread_anchor": ..., "notified": ...}}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EntityRecord {

    private final String status;

    /** Reference to the opening notification; {@code null} until one was sent. */
    private final String threadAnchor;

    /** Whether an initial notification was ever delivered for this key. */
    private final boolean notified;

    @JsonCreator
    public EntityRecord(@JsonProperty("status") String status,
            @JsonProperty("thread_anchor") String threadAnchor,
            @JsonProperty("notified") boolean notified) {
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.threadAnchor = threadAnchor;
        this.notified = notified;
    }

    /**
     * A record for an entity seen for the first time and not yet announced.
     *
     * @param status observed status
     * @return new record with no anchor and {@code notified = false}
     */
    public static EntityRecord unnotified(String status) {
        return new EntityRecord(status, null, false);
    }

    @JsonProperty("status")
    public String getStatus() {
        return status;
    }

    @JsonProperty("thread_anchor")
    public String getThreadAnchor() {
        return threadAnchor;
    }

    public Optional<String> threadAnchor() {
        return Optional.ofNullable(threadAnchor);
    }

    @JsonProperty("notified")
    public boolean isNotified() {
        return notified;
    }

    /**
     * Merge an update into this record. A {@code null} anchor or notified flag
     * keeps the current value.
     *
     * @param newStatus    replacement status
     * @param newAnchor    replacement anchor, or {@code null} to keep
     * @param newNotified  replacement flag, or {@code null} to keep
     * @return merged record
     */
    public EntityRecord merge(String newStatus, String newAnchor, Boolean newNotified) {
        return new EntityRecord(
                newStatus,
                newAnchor != null ? newAnchor : threadAnchor,
                newNotified != null ? newNotified : notified);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityRecord that))
            return false;
        return notified == that.notified
                && status.equals(that.status)
                && Objects.equals(threadAnchor, that.threadAnchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, threadAnchor, notified);
    }

    @Override
    public String toString() {
        return "EntityRecord{" +
                "status='" + status + '\'' +
                ", threadAnchor='" + threadAnchor + '\'' +
                ", notified=" + notified +
                '}';
    }
}
