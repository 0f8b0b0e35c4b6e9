package com.govsentinel.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.govsentinel.core.orchestrator.PassReport;

import java.time.Instant;

/**
 * Point-in-time view of one source, serialized by {@link HealthServer}.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SourceStatus {

    private final String name;
    private final String state;
    private final long passes;
    private final Instant lastPassAt;
    private final Integer notificationsSent;
    private final Integer scopesFailed;
    private final boolean failed;
    private final String error;

    SourceStatus(String name, String state, long passes, Instant lastPassAt, PassReport lastReport,
            boolean failed, String error) {
        this.name = name;
        this.state = state;
        this.passes = passes;
        this.lastPassAt = lastPassAt;
        this.notificationsSent = lastReport != null ? lastReport.getNotificationsSent() : null;
        this.scopesFailed = lastReport != null ? lastReport.getScopesFailed() : null;
        this.failed = failed;
        this.error = error;
    }

    static SourceStatus failedAtStartup(String name, String error) {
        return new SourceStatus(name, "FAILED", 0, null, null, true, error);
    }

    public String getName() {
        return name;
    }

    public String getState() {
        return state;
    }

    public long getPasses() {
        return passes;
    }

    public Instant getLastPassAt() {
        return lastPassAt;
    }

    public Integer getNotificationsSent() {
        return notificationsSent;
    }

    public Integer getScopesFailed() {
        return scopesFailed;
    }

    public boolean isFailed() {
        return failed;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "SourceStatus{" + name + ", " + state + ", passes=" + passes
                + (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
