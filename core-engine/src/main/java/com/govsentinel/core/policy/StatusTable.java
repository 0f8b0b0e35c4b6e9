package com.govsentinel.core.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Status vocabulary of one source family, loaded from {@code policies.yml}.
 *
 * <ul>
 * <li>{@code active}: statuses worth opening a thread for</li>
 * <li>{@code update}: secondary active statuses announced as a follow-up
 * when entered from an active status (e.g. {@code extended},
 * {@code passed})</li>
 * <li>{@code terminal}: statuses after which the entity is no longer
 * watched</li>
 * </ul>
 *
 * <p>
 * Labels are compared case-insensitively. Call {@link #validate()} after
 * deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusTable {

    private String family;
    private List<String> active = new ArrayList<>();
    private List<String> update = new ArrayList<>();
    private List<String> terminal = new ArrayList<>();

    public StatusTable() {
    }

    public StatusTable(String family, List<String> active, List<String> update, List<String> terminal) {
        setFamily(family);
        setActive(active);
        setUpdate(update);
        setTerminal(terminal);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if the family is unnamed, has no active
     *                               status, or lists a status in more than
     *                               one set
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (family == null || family.isBlank()) {
            errors.add("Policy 'family' is required");
        }
        if (active.isEmpty()) {
            errors.add("Policy '" + family + "' requires at least one 'active' status");
        }
        if (terminal.isEmpty()) {
            errors.add("Policy '" + family + "' requires at least one 'terminal' status");
        }
        for (String status : activeSet()) {
            if (updateSet().contains(status) || terminalSet().contains(status)) {
                errors.add("Policy '" + family + "' lists status '" + status + "' in more than one set");
            }
        }
        for (String status : updateSet()) {
            if (terminalSet().contains(status)) {
                errors.add("Policy '" + family + "' lists status '" + status + "' in more than one set");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid StatusTable: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Lookups
    // ---------------------------------------------------------------

    public boolean isActive(String status) {
        return status != null && activeSet().contains(normalize(status));
    }

    public boolean isUpdate(String status) {
        return status != null && updateSet().contains(normalize(status));
    }

    public boolean isTerminal(String status) {
        return status != null && terminalSet().contains(normalize(status));
    }

    Set<String> activeSet() {
        return asSet(active);
    }

    Set<String> updateSet() {
        return asSet(update);
    }

    Set<String> terminalSet() {
        return asSet(terminal);
    }

    static String normalize(String status) {
        return status.trim().toLowerCase(Locale.ROOT);
    }

    private static Set<String> asSet(List<String> statuses) {
        Set<String> set = new LinkedHashSet<>();
        for (String s : statuses) {
            if (s != null) {
                set.add(normalize(s));
            }
        }
        return set;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getFamily() {
        return family;
    }

    /**
     * @param family family name, normalised to lowercase
     */
    public void setFamily(String family) {
        this.family = family != null ? family.trim().toLowerCase(Locale.ROOT) : null;
    }

    public List<String> getActive() {
        return Collections.unmodifiableList(active);
    }

    public void setActive(List<String> active) {
        this.active = active != null ? new ArrayList<>(active) : new ArrayList<>();
    }

    public List<String> getUpdate() {
        return Collections.unmodifiableList(update);
    }

    public void setUpdate(List<String> update) {
        this.update = update != null ? new ArrayList<>(update) : new ArrayList<>();
    }

    public List<String> getTerminal() {
        return Collections.unmodifiableList(terminal);
    }

    public void setTerminal(List<String> terminal) {
        this.terminal = terminal != null ? new ArrayList<>(terminal) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StatusTable that))
            return false;
        return Objects.equals(family, that.family)
                && activeSet().equals(that.activeSet())
                && updateSet().equals(that.updateSet())
                && terminalSet().equals(that.terminalSet());
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, activeSet(), updateSet(), terminalSet());
    }

    @Override
    public String toString() {
        return "StatusTable{" +
                "family='" + family + '\'' +
                ", active=" + active +
                ", update=" + update +
                ", terminal=" + terminal +
                '}';
    }
}
