package com.govsentinel.core.config;

import com.govsentinel.core.policy.StatusTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for {@code policies.yml}.
 *
 * <pre>
 * policies:
 *   - family: snapshot
 *     active: [active]
 *     terminal: [closed, deleted]
 * </pre>
 *
 * @since 1.0.0
 */
public class PoliciesConfig {

    private List<StatusTable> policies = new ArrayList<>();

    public List<StatusTable> getPolicies() {
        return Collections.unmodifiableList(policies);
    }

    public void setPolicies(List<StatusTable> policies) {
        this.policies = policies != null ? new ArrayList<>(policies) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "PoliciesConfig{policies=" + policies + '}';
    }
}
