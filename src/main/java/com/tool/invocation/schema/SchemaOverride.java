package com.tool.invocation.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Patch applied to a derived schema for tools whose signatures are historically inconsistent.
 * Implementations receive a private deep copy and may modify it freely.
 */
@FunctionalInterface
public interface SchemaOverride {

    Map<String, Object> patch(Map<String, Object> schema);

    /**
     * Applies this override to a copy of {@code schema}; the argument is never modified.
     */
    default Map<String, Object> apply(Map<String, Object> schema) {
        return Objects.requireNonNull(patch(Schemas.deepCopy(schema)), "override returned null");
    }

    default SchemaOverride andThen(SchemaOverride next) {
        return schema -> next.patch(patch(schema));
    }

    /**
     * Allows a property to take any of the given types, e.g. {@code widenType("line", "integer", "string")}.
     */
    static SchemaOverride widenType(String property, String... types) {
        List<String> widened = List.copyOf(Arrays.asList(types));
        return schema -> {
            Map<String, Object> prop = requireProperty(schema, property);
            prop.put("type", new ArrayList<>(widened));
            prop.remove("items");
            return schema;
        };
    }

    /**
     * Forces array-of-string semantics on a property, keeping its description, nullability and default.
     */
    static SchemaOverride stringArray(String property) {
        return schema -> {
            Map<String, Object> prop = requireProperty(schema, property);
            prop.put("type", "array");
            Map<String, Object> items = new LinkedHashMap<>();
            items.put("type", "string");
            prop.put("items", items);
            return schema;
        };
    }

    /**
     * Makes a required property optional with a {@code null} default.
     */
    static SchemaOverride makeOptional(String property) {
        return schema -> {
            Map<String, Object> prop = requireProperty(schema, property);
            Object required = schema.get("required");
            if (required instanceof List<?> list) {
                list.remove(property);
            }
            prop.put("nullable", true);
            prop.putIfAbsent("default", null);
            return schema;
        };
    }

    /**
     * Discards the derived schema in favour of a hand-written one.
     */
    static SchemaOverride replace(Map<String, Object> replacement) {
        Map<String, Object> fixed = Schemas.deepCopy(replacement);
        return ignored -> Schemas.deepCopy(fixed);
    }

    private static Map<String, Object> requireProperty(Map<String, Object> schema, String property) {
        Map<String, Object> properties = Schemas.properties(schema);
        Object prop = properties.get(property);
        if (!(prop instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Schema has no property '" + property + "' to override");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> typed = (Map<String, Object>) prop;
        return typed;
    }
}
