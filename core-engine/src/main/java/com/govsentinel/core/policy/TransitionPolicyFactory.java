package com.govsentinel.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a source family name to its {@link TransitionPolicy}.
 *
 * <p>
 * Platform differences are data: adding a governance platform means adding a
 * {@link StatusTable} to {@code policies.yml}, not a new class.
 * </p>
 *
 * @since 1.0.0
 */
public final class TransitionPolicyFactory {

    private static final Logger LOG = LoggerFactory.getLogger(TransitionPolicyFactory.class);

    private final Map<String, TransitionPolicy> policies;

    /**
     * @param tables status tables, one per family; family names must be unique
     * @throws IllegalArgumentException if a family is declared twice
     * @throws IllegalStateException    if a table is invalid
     */
    public TransitionPolicyFactory(List<StatusTable> tables) {
        Objects.requireNonNull(tables, "tables must not be null");
        Map<String, TransitionPolicy> byFamily = new LinkedHashMap<>();
        for (StatusTable table : tables) {
            TransitionPolicy policy = new TransitionPolicy(table);
            if (byFamily.putIfAbsent(policy.getFamily(), policy) != null) {
                throw new IllegalArgumentException("Duplicate policy family: '" + policy.getFamily() + "'");
            }
        }
        this.policies = Collections.unmodifiableMap(byFamily);
        LOG.info("Registered {} transition policy family(ies): {}", policies.size(), policies.keySet());
    }

    /**
     * @param family family name (case-insensitive)
     * @return the policy
     * @throws IllegalArgumentException if the family is unknown
     */
    public TransitionPolicy forFamily(String family) {
        Objects.requireNonNull(family, "family must not be null");
        TransitionPolicy policy = policies.get(family.trim().toLowerCase(Locale.ROOT));
        if (policy == null) {
            throw new IllegalArgumentException(
                    "Unknown policy family: '" + family + "'. Supported families: " + policies.keySet());
        }
        return policy;
    }

    public boolean supports(String family) {
        return family != null && policies.containsKey(family.trim().toLowerCase(Locale.ROOT));
    }

    public java.util.Set<String> families() {
        return policies.keySet();
    }
}
