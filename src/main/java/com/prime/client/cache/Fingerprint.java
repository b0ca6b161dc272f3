package com.prime.client.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * SHA-256 identity of a (resource name, query parameters) pair.
 *
 * <p>Parameters are serialized canonically before hashing: map keys sorted at
 * every nesting level, null values dropped and scalar values written in their
 * query-string form, so {@code 1} and {@code "1"} are the same parameter. Two
 * parameter maps that go out as the same query therefore produce the same
 * fingerprint whatever their insertion order.</p>
 *
 * @param value lowercase hex digest
 */
public record Fingerprint(String value) {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public Fingerprint {
        Objects.requireNonNull(value, "value is required");
    }

    public static Fingerprint of(String resourceName, Map<String, ?> params) {
        Objects.requireNonNull(resourceName, "resourceName is required");
        String canonical = resourceName + "\n" + canonicalParams(params);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return new Fingerprint(HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String canonicalParams(Map<String, ?> params) {
        try {
            return CANONICAL.writeValueAsString(params != null ? normalize(params) : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Query parameters cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new TreeMap<>();
            map.forEach((k, v) -> {
                if (v != null) {
                    normalized.put(String.valueOf(k), normalize(v));
                }
            });
            return normalized;
        }
        if (value instanceof Collection<?> items) {
            List<Object> normalized = new ArrayList<>(items.size());
            items.forEach(item -> normalized.add(item != null ? normalize(item) : null));
            return normalized;
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
