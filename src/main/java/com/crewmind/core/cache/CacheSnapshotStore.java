package com.crewmind.core.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists response cache contents as a JSON array of {@link CacheEntry} so a later
 * process can reuse earlier tool results. Failures are logged and never propagated.
 */
public class CacheSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(CacheSnapshotStore.class);

    private final ObjectMapper objectMapper;

    public CacheSnapshotStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void export(ResponseCache cache, Path file) {
        var entries = cache.snapshot();
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entries);
            log.info("Exported {} cached responses to {}", entries.size(), file);
        } catch (IOException e) {
            log.warn("Failed to export cache snapshot to {}: {}", file, e.getMessage());
        }
    }

    /** @return number of entries restored; 0 when the file is missing or unreadable */
    public int load(ResponseCache cache, Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("No cache snapshot at {}", file);
            return 0;
        }
        try {
            List<CacheEntry> entries = objectMapper.readValue(file.toFile(), new TypeReference<>() {});
            return cache.restore(entries);
        } catch (IOException e) {
            log.warn("Failed to load cache snapshot from {}: {}", file, e.getMessage());
            return 0;
        }
    }
}
