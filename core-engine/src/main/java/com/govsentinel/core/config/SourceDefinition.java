package com.govsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One governance source as declared in {@code monitors.yml}.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * - name: snapshot
 *   family: snapshot
 *   minRequestIntervalMillis: 1000
 *   initialBackoffMillis: 2000
 *   maxRetries: 3
 *   pollIntervalSeconds: 60
 *   fetchTimeoutSeconds: 30
 *   sendTimeoutSeconds: 30
 *   continuous: true
 *   recheckTracked: true
 *   scopes:
 *     - id: aave.eth
 *       displayName: Aave
 *       actionLinkBase: https://snapshot.org/#/aave.eth
 *       channel: app
 * </pre>
 *
 * @since 1.0.0
 */
public class SourceDefinition {

    private String name;
    private String family;
    private List<ScopeDefinition> scopes = new ArrayList<>();
    private long minRequestIntervalMillis = 1_000L;
    private long initialBackoffMillis = 2_000L;
    private int maxRetries = 3;
    private long pollIntervalSeconds = 60L;
    private long fetchTimeoutSeconds = 30L;
    private long sendTimeoutSeconds = 30L;
    private boolean continuous = true;
    private boolean recheckTracked = true;
    private boolean enabled = true;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Source 'name' is required");
        } else if (!name.matches("[A-Za-z0-9_-]+")) {
            errors.add("Source name '" + name + "' may only contain letters, digits, '_' and '-'");
        }
        if (family == null || family.isBlank()) {
            errors.add("Source '" + name + "' requires a policy 'family'");
        }
        if (minRequestIntervalMillis < 0) {
            errors.add("Source '" + name + "' minRequestIntervalMillis must be >= 0");
        }
        if (initialBackoffMillis < 0) {
            errors.add("Source '" + name + "' initialBackoffMillis must be >= 0");
        }
        if (maxRetries < 0) {
            errors.add("Source '" + name + "' maxRetries must be >= 0");
        }
        if (pollIntervalSeconds < 0) {
            errors.add("Source '" + name + "' pollIntervalSeconds must be >= 0");
        }
        if (fetchTimeoutSeconds <= 0 || sendTimeoutSeconds <= 0) {
            errors.add("Source '" + name + "' timeouts must be > 0");
        }

        Set<String> seen = new HashSet<>();
        for (ScopeDefinition scope : scopes) {
            if (scope == null) {
                errors.add("Source '" + name + "' has a null scope entry");
                continue;
            }
            try {
                scope.validate();
            } catch (IllegalStateException e) {
                errors.add("Source '" + name + "': " + e.getMessage());
            }
            if (scope.getId() != null && !seen.add(scope.getId())) {
                errors.add("Source '" + name + "' declares scope '" + scope.getId() + "' twice");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getFamily() {
        return family;
    }

    public void setFamily(String family) {
        this.family = family;
    }

    public List<ScopeDefinition> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public void setScopes(List<ScopeDefinition> scopes) {
        this.scopes = scopes != null ? new ArrayList<>(scopes) : new ArrayList<>();
    }

    public long getMinRequestIntervalMillis() {
        return minRequestIntervalMillis;
    }

    public void setMinRequestIntervalMillis(long minRequestIntervalMillis) {
        this.minRequestIntervalMillis = minRequestIntervalMillis;
    }

    public long getInitialBackoffMillis() {
        return initialBackoffMillis;
    }

    public void setInitialBackoffMillis(long initialBackoffMillis) {
        this.initialBackoffMillis = initialBackoffMillis;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(long pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public long getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public void setFetchTimeoutSeconds(long fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    public long getSendTimeoutSeconds() {
        return sendTimeoutSeconds;
    }

    public void setSendTimeoutSeconds(long sendTimeoutSeconds) {
        this.sendTimeoutSeconds = sendTimeoutSeconds;
    }

    public boolean isContinuous() {
        return continuous;
    }

    public void setContinuous(boolean continuous) {
        this.continuous = continuous;
    }

    public boolean isRecheckTracked() {
        return recheckTracked;
    }

    public void setRecheckTracked(boolean recheckTracked) {
        this.recheckTracked = recheckTracked;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return "SourceDefinition{" +
                "name='" + name + '\'' +
                ", family='" + family + '\'' +
                ", scopes=" + scopes.size() +
                ", pollIntervalSeconds=" + pollIntervalSeconds +
                ", continuous=" + continuous +
                '}';
    }
}
