package com.govsentinel.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Identifiers for which a one-shot admin alert was already delivered.
 *
 * <p>
 * Persisted as {@code {"<identifier>": true}}. Entries never expire; an
 * operator clears them explicitly once the watch target is fixed.
 * </p>
 *
 * @since 1.0.0
 */
public class AdminAlertRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AdminAlertRegistry.class);
    private static final TypeReference<LinkedHashMap<String, Boolean>> DOCUMENT_TYPE =
            new TypeReference<>() {
            };

    private final JsonDocumentFile<LinkedHashMap<String, Boolean>> file;
    private final Map<String, Boolean> warned = new LinkedHashMap<>();

    public AdminAlertRegistry(Path path, ObjectMapper mapper) {
        this.file = new JsonDocumentFile<>(path, mapper, DOCUMENT_TYPE);
        file.read().ifPresent(warned::putAll);
        LOG.info("Loaded admin alert state from {}: {} warned identifier(s)", path, warnedIds().size());
    }

    public synchronized boolean isWarned(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        return Boolean.TRUE.equals(warned.get(identifier));
    }

    public synchronized void markWarned(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        warned.put(identifier, Boolean.TRUE);
        file.write(new LinkedHashMap<>(warned));
    }

    /**
     * @param identifier identifier to re-arm
     * @return {@code true} if it had been warned
     */
    public synchronized boolean clear(String identifier) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        if (warned.remove(identifier) == null) {
            return false;
        }
        file.write(new LinkedHashMap<>(warned));
        return true;
    }

    public synchronized Set<String> warnedIds() {
        Set<String> ids = new TreeSet<>();
        warned.forEach((id, flag) -> {
            if (Boolean.TRUE.equals(flag)) {
                ids.add(id);
            }
        });
        return Collections.unmodifiableSet(ids);
    }
}
