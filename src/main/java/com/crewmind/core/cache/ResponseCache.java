package com.crewmind.core.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Shared store of tool responses keyed by {@link CacheKey}.
 * Implementations are thread-safe and never propagate internal failures to callers.
 */
public interface ResponseCache {

    Optional<String> get(CacheKey key);

    void put(CacheKey key, String value, Duration ttl);

    /** Stores a response with the configured default ttl. */
    void put(CacheKey key, String value);

    long hits();

    long misses();

    /** Live, unexpired entries for export. */
    List<CacheEntry> snapshot();

    /** Adds entries from a snapshot; expired ones are dropped. Returns the number restored. */
    int restore(List<CacheEntry> entries);

    void clear();
}
