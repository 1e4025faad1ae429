package com.tool.invocation.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks call arguments against a tool's input schema.
 *
 * <p>Supports the subset of JSON Schema that {@link SchemaDeriver} and {@link SchemaOverride} produce:
 * {@code type} (single or list), {@code nullable}, {@code properties}, {@code required},
 * {@code additionalProperties}, {@code items} and {@code enum}. Arguments the schema does not
 * declare are rejected unless the root schema sets {@code additionalProperties}.</p>
 */
public class SchemaValidator {

    public ValidationResult validate(Map<String, Object> schema, Map<String, Object> args) {
        Map<String, Object> arguments = args != null ? args : Map.of();
        Map<String, Object> properties = Schemas.properties(schema);
        List<String> required = Schemas.required(schema);

        List<String> errors = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String name : required) {
            if (!arguments.containsKey(name)) {
                missing.add(name);
                errors.add(name + ": required argument is missing");
            }
        }

        List<String> unknown = new ArrayList<>();
        Map<String, String> suggestions = new LinkedHashMap<>();
        boolean openRoot = allowsAdditional(schema);
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            String name = entry.getKey();
            Object propertySchema = properties.get(name);
            if (propertySchema instanceof Map<?, ?> map) {
                checkValue(name, asSchema(map), entry.getValue(), errors);
            } else if (!openRoot) {
                unknown.add(name);
                NameSuggester.suggest(name, properties.keySet())
                        .ifPresent(s -> suggestions.put(name, s));
                errors.add(name + ": unknown argument");
            }
        }

        Set<String> requiredSet = new HashSet<>(required);
        List<String> optional = new ArrayList<>();
        for (String name : properties.keySet()) {
            if (!requiredSet.contains(name)) {
                optional.add(name);
            }
        }
        return new ValidationResult(errors, unknown, suggestions, missing, required, optional);
    }

    private void checkValue(String path, Map<String, Object> schema, Object value, List<String> errors) {
        if (value == null) {
            if (!Schemas.isNullable(schema) && !Schemas.types(schema).isEmpty()) {
                errors.add(path + ": null is not allowed");
            }
            return;
        }
        List<String> types = Schemas.types(schema);
        if (!types.isEmpty() && types.stream().noneMatch(t -> matches(t, value))) {
            errors.add(path + ": expected " + String.join(" or ", types) + " but got " + jsonType(value));
            return;
        }
        Object allowed = schema.get("enum");
        if (allowed instanceof List<?> values && !values.contains(value)) {
            errors.add(path + ": value " + value + " is not one of " + values);
        }
        if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> items) {
            Map<String, Object> itemSchema = asSchema(items);
            for (int i = 0; i < list.size(); i++) {
                checkValue(path + "[" + i + "]", itemSchema, list.get(i), errors);
            }
        }
        if (value instanceof Map<?, ?> map) {
            checkObject(path, schema, map, errors);
        }
    }

    private void checkObject(String path, Map<String, Object> schema, Map<?, ?> value, List<String> errors) {
        Map<String, Object> properties = Schemas.properties(schema);
        for (String name : Schemas.required(schema)) {
            if (!value.containsKey(name)) {
                errors.add(path + "." + name + ": required argument is missing");
            }
        }
        Object additional = schema.get("additionalProperties");
        for (Map.Entry<?, ?> entry : value.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object propertySchema = properties.get(key);
            if (propertySchema instanceof Map<?, ?> map) {
                checkValue(path + "." + key, asSchema(map), entry.getValue(), errors);
            } else if (additional instanceof Map<?, ?> map) {
                checkValue(path + "." + key, asSchema(map), entry.getValue(), errors);
            } else if (!properties.isEmpty() && !Boolean.TRUE.equals(additional)) {
                errors.add(path + "." + key + ": unknown field");
            }
        }
    }

    private static boolean allowsAdditional(Map<String, Object> schema) {
        Object additional = schema != null ? schema.get("additionalProperties") : null;
        return additional instanceof Map<?, ?> || Boolean.TRUE.equals(additional);
    }

    private static boolean matches(String type, Object value) {
        return switch (type) {
            case "string" -> value instanceof String || value instanceof Character;
            case "integer" -> isIntegral(value);
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "array" -> value instanceof List<?> || value.getClass().isArray();
            case "object" -> value instanceof Map<?, ?>;
            case "null" -> false;
            default -> true;
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private static String jsonType(Object value) {
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Number) {
            return isIntegral(value) ? "integer" : "number";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        return value.getClass().getSimpleName();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asSchema(Map<?, ?> map) {
        return (Map<String, Object>) map;
    }
}
