package com.tool.invocation.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for working with input schemas represented as nested {@code Map}/{@code List} values.
 */
public final class Schemas {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Schemas() {
        // utility class
    }

    /**
     * An object schema with no arguments.
     */
    public static Map<String, Object> emptyObject() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", new LinkedHashMap<String, Object>());
        schema.put("required", new ArrayList<String>());
        return schema;
    }

    /**
     * Deep, mutable copy of a schema (maps keep their insertion order).
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
            }
            return (T) out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(deepCopy(item));
            }
            return (T) out;
        }
        return value;
    }

    /**
     * Property schemas keyed by argument name; empty if the schema declares none.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> properties(Map<String, Object> schema) {
        Object props = schema != null ? schema.get("properties") : null;
        return props instanceof Map<?, ?> ? (Map<String, Object>) props : Collections.emptyMap();
    }

    /**
     * Names of required arguments; empty if the schema declares none.
     */
    public static List<String> required(Map<String, Object> schema) {
        Object req = schema != null ? schema.get("required") : null;
        if (!(req instanceof List<?> list)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof String s) {
                out.add(s);
            }
        }
        return out;
    }

    /**
     * Declared types of a property schema; {@code "type": "x"} and {@code "type": ["x", "y"]} are both accepted.
     * An empty list means the property accepts any type.
     */
    public static List<String> types(Map<String, Object> propertySchema) {
        Object type = propertySchema != null ? propertySchema.get("type") : null;
        if (type instanceof String s) {
            return List.of(s);
        }
        if (type instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(String.valueOf(item));
            }
            return out;
        }
        return List.of();
    }

    public static boolean isNullable(Map<String, Object> propertySchema) {
        return Boolean.TRUE.equals(propertySchema.get("nullable")) || types(propertySchema).contains("null");
    }

    /**
     * Key-sorted, compact JSON form. Two schemas with the same content always produce the same string.
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * SHA-256 of the canonical JSON form, hex-encoded.
     */
    public static String hash(Map<String, Object> schema) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(canonicalJson(schema).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
