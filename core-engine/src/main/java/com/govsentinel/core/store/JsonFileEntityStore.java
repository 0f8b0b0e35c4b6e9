package com.govsentinel.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.model.EntityKey;
import com.govsentinel.core.model.EntityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EntityStore} persisted as a single JSON document.
 *
 * <pre>
 * {
 *   "uniswap.eth:0xabc": {"status": "active", "thread_anchor": "1718.22", "notified": true}
 * }
 * </pre>
 *
 * <p>
 * The whole document is rewritten on every mutation. Write volume is tiny
 * (tens of entities, one pass per minute), so there is no batching.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileEntityStore implements EntityStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileEntityStore.class);
    private static final TypeReference<LinkedHashMap<String, JsonNode>> DOCUMENT_TYPE =
            new TypeReference<>() {
            };

    private final ObjectMapper mapper;
    private final JsonDocumentFile<LinkedHashMap<String, JsonNode>> file;
    private final Map<EntityKey, EntityRecord> records = new LinkedHashMap<>();

    /**
     * Open the store, loading any existing document.
     *
     * @param path   location of the state document
     * @param mapper shared Jackson mapper
     */
    public JsonFileEntityStore(Path path, ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.file = new JsonDocumentFile<>(path, mapper, DOCUMENT_TYPE);
        file.read().ifPresent(doc -> doc.forEach(this::loadEntry));
        LOG.info("Loaded state from {}: {} entities", path, records.size());
    }

    // One bad entry is dropped on its own so the next flush keeps the rest.
    private void loadEntry(String rawKey, JsonNode node) {
        if (node == null || node.isNull()) {
            LOG.warn("Dropping null record for key '{}' in {}", rawKey, file.path());
            return;
        }
        EntityRecord record;
        try {
            record = mapper.treeToValue(node, EntityRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warn("Dropping unreadable record for key '{}' in {}: {}", rawKey, file.path(), e.getMessage());
            return;
        }
        try {
            records.put(EntityKey.parse(rawKey), record);
        } catch (IllegalArgumentException e) {
            LOG.warn("Dropping malformed key '{}' in {}: {}", rawKey, file.path(), e.getMessage());
        }
    }

    @Override
    public synchronized Optional<EntityRecord> get(EntityKey key) {
        Objects.requireNonNull(key, "key must not be null");
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public synchronized EntityRecord upsert(EntityKey key, String status, String threadAnchor, Boolean notified) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(status, "status must not be null");

        EntityRecord existing = records.get(key);
        EntityRecord updated = existing != null
                ? existing.merge(status, threadAnchor, notified)
                : new EntityRecord(status, threadAnchor, notified != null && notified);

        records.put(key, updated);
        flush();
        return updated;
    }

    @Override
    public synchronized boolean remove(EntityKey key) {
        Objects.requireNonNull(key, "key must not be null");
        if (records.remove(key) == null) {
            return false;
        }
        flush();
        return true;
    }

    @Override
    public synchronized int count() {
        return records.size();
    }

    @Override
    public synchronized Map<EntityKey, EntityRecord> all() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    public Path path() {
        return file.path();
    }

    private void flush() {
        LinkedHashMap<String, JsonNode> doc = new LinkedHashMap<>();
        records.forEach((k, v) -> doc.put(k.asString(), mapper.valueToTree(v)));
        file.write(doc);
    }
}
