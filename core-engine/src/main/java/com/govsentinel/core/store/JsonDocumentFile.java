package com.govsentinel.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * A JSON document on disk, read once and rewritten whole.
 *
 * <p>
 * Writes go to a sibling temp file which is then moved over the target, so a
 * crash mid-write leaves the previous document intact. Both read and write
 * failures are logged and swallowed into "no document" / "not written":
 * callers keep their in-memory state authoritative.
 * </p>
 */
final class JsonDocumentFile<T> {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDocumentFile.class);

    private final Path path;
    private final ObjectMapper mapper;
    private final TypeReference<T> type;

    JsonDocumentFile(Path path, ObjectMapper mapper, TypeReference<T> type) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    Path path() {
        return path;
    }

    /**
     * @return the parsed document, or empty if the file is absent or unreadable
     */
    Optional<T> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            LOG.error("Error loading state from {}, starting empty: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param document the full document to persist
     * @return {@code true} if the document reached disk
     */
    boolean write(T document) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Saved state to {}", path);
            return true;
        } catch (IOException e) {
            LOG.error("Error saving state to {}, keeping in-memory state: {}", path, e.getMessage(), e);
            return false;
        }
    }
}
