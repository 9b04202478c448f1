package com.crewmind.core.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    @DisplayName("parameter order, name case and whitespace do not change the key")
    void normalizationProducesSameKey() {
        var a = new LinkedHashMap<String, Object>();
        a.put("query", "cabo   luxury resorts ");
        a.put("limit", 5);
        var b = new LinkedHashMap<String, Object>();
        b.put("Limit", 5);
        b.put(" QUERY", "  cabo luxury\tresorts");

        assertEquals(CacheKey.of("web_search", a), CacheKey.of("web_search", b));
    }

    @Test
    @DisplayName("different values or tools produce different keys")
    void differentInputsDiffer() {
        var base = CacheKey.of("web_search", Map.of("query", "cabo"));
        assertNotEquals(base, CacheKey.of("web_search", Map.of("query", "tulum")));
        assertNotEquals(base, CacheKey.of("fetch_url", Map.of("query", "cabo")));
        assertNotEquals(base, CacheKey.of("web_search", Map.of("query", "cabo", "limit", 3)));
    }

    @Test
    @DisplayName("nested maps and lists are normalized recursively")
    void nestedNormalization() {
        var normalized = CacheKey.normalize(Map.of("Filters", List.of(Map.of("Region ", " Baja  Sur"))));
        assertEquals(Map.of("filters", List.of(Map.of("region", "Baja Sur"))), normalized);
    }

    @Test
    @DisplayName("null and empty parameters share a key")
    void nullParameters() {
        assertEquals(CacheKey.of("t", null), CacheKey.of("t", Map.of()));
    }

    @Test
    @DisplayName("digest is hex SHA-256 and toString prefixes the tool id")
    void digestFormat() {
        var key = CacheKey.of("read_file", Map.of("path", "notes.md"));
        assertEquals(64, key.digest().length());
        assertTrue(key.digest().matches("[0-9a-f]+"));
        assertEquals("read_file:" + key.digest(), key.toString());
    }
}
