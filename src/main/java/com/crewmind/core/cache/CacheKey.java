package com.crewmind.core.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Identity of a tool call: the tool id plus a SHA-256 digest of its normalized parameters.
 * <p>
 * Normalization lower-cases parameter names, trims string values and collapses
 * internal whitespace, and orders map keys, so {@code {"Query":" a  b "}} and
 * {@code {"query":"a b"}} produce the same key.
 */
public record CacheKey(String toolId, String digest) {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static CacheKey of(String toolId, Map<String, Object> parameters) {
        Object normalized = normalize(parameters == null ? Map.of() : parameters);
        try {
            byte[] json = CANONICAL.writeValueAsBytes(normalized);
            return new CacheKey(toolId, sha256(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool parameters are not serializable: " + e.getMessage(), e);
        }
    }


    static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            var sorted = new TreeMap<String, Object>();
            for (var entry : map.entrySet()) {
                String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
                sorted.put(name, normalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List<?> list) {
            var out = new ArrayList<>(list.size());
            for (var item : list) {
                out.add(normalize(item));
            }
            return out;
        }
        if (value instanceof String s) {
            return s.trim().replaceAll("\\s+", " ");
        }
        return value;
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return toolId + ":" + digest;
    }
}
