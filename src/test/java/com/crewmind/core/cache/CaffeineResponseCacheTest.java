package com.crewmind.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineResponseCacheTest {

    private MutableClock clock;
    private CaffeineResponseCache cache;

    private final CacheKey key = CacheKey.of("web_search", Map.of("query", "cabo"));

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        cache = new CaffeineResponseCache(Duration.ofHours(1), 100, clock);
    }

    @Test
    @DisplayName("stored value is returned and counted as a hit")
    void hit() {
        cache.put(key, "results");

        assertEquals(Optional.of("results"), cache.get(key));
        assertEquals(1, cache.hits());
        assertEquals(0, cache.misses());
    }

    @Test
    @DisplayName("unknown key is a miss")
    void miss() {
        assertTrue(cache.get(key).isEmpty());
        assertEquals(1, cache.misses());
    }

    @Test
    @DisplayName("entry is a miss once its ttl has elapsed")
    void expiry() {
        cache.put(key, "results", Duration.ofMinutes(10));

        clock.advance(Duration.ofMinutes(9));
        assertTrue(cache.get(key).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get(key).isEmpty());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    @DisplayName("zero ttl never serves a value")
    void zeroTtl() {
        cache.put(key, "results", Duration.ZERO);
        assertTrue(cache.get(key).isEmpty());
    }

    @Test
    @DisplayName("null values are not stored")
    void nullValueIgnored() {
        cache.put(key, null);
        assertTrue(cache.get(key).isEmpty());
    }

    @Test
    @DisplayName("clear drops every entry")
    void clear() {
        cache.put(key, "results");
        cache.clear();
        assertTrue(cache.get(key).isEmpty());
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

        @Test
        @DisplayName("export then load restores live entries into a new cache")
        void exportAndLoad(@TempDir Path dir) {
            cache.put(key, "results");
            var expiring = CacheKey.of("fetch_url", Map.of("url", "https://example.com"));
            cache.put(expiring, "page", Duration.ofMinutes(1));
            clock.advance(Duration.ofMinutes(2));

            var store = new CacheSnapshotStore(objectMapper);
            Path file = dir.resolve("snapshots/cache.json");
            store.export(cache, file);
            assertTrue(Files.exists(file));

            var fresh = new CaffeineResponseCache(Duration.ofHours(1), 100, clock);
            assertEquals(1, store.load(fresh, file));
            assertEquals(Optional.of("results"), fresh.get(key));
            assertTrue(fresh.get(expiring).isEmpty());
        }

        @Test
        @DisplayName("missing or corrupt snapshot loads nothing")
        void badSnapshot(@TempDir Path dir) throws Exception {
            var store = new CacheSnapshotStore(objectMapper);
            assertEquals(0, store.load(cache, dir.resolve("absent.json")));

            Path corrupt = dir.resolve("corrupt.json");
            Files.writeString(corrupt, "{not json");
            assertEquals(0, store.load(cache, corrupt));
        }
    }
}
