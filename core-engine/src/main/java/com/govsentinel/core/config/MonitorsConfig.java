package com.govsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Top-level POJO for {@code monitors.yml}: the list of governance sources to
 * watch.
 *
 * @since 1.0.0
 */
public class MonitorsConfig {

    private List<SourceDefinition> sources = new ArrayList<>();

    public List<SourceDefinition> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public void setSources(List<SourceDefinition> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    /**
     * @return enabled sources, in declaration order
     */
    public List<SourceDefinition> enabledSources() {
        List<SourceDefinition> enabled = new ArrayList<>();
        for (SourceDefinition source : sources) {
            if (source.isEnabled()) {
                enabled.add(source);
            }
        }
        return enabled;
    }

    public Optional<SourceDefinition> source(String name) {
        return sources.stream().filter(s -> Objects.equals(s.getName(), name)).findFirst();
    }

    /**
     * Validate every source and check that names are unique.
     *
     * @throws IllegalStateException if one or more sources are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < sources.size(); i++) {
            SourceDefinition source = Objects.requireNonNull(sources.get(i),
                    "Source at index " + i + " is null");
            try {
                source.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (source.getName() != null && !names.add(source.getName())) {
                errors.add("Duplicate source name: '" + source.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitors configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "MonitorsConfig{sources=" + sources + '}';
    }
}
