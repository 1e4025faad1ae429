package com.tool.invocation.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Derives a tool's input schema from the record that declares its arguments.
 *
 * <p>The output has the shape {@code {type: "object", properties: {...}, required: [...]}}.
 * Properties appear in record component order, so deriving twice from an unchanged record
 * yields identical output.</p>
 *
 * <p>Type mapping:</p>
 * <ul>
 *   <li>{@code String}, {@code char}, {@code UUID} and enums map to {@code string} (enums add {@code enum})</li>
 *   <li>integral types and {@code BigInteger} map to {@code integer}</li>
 *   <li>floating point types and {@code BigDecimal} map to {@code number}</li>
 *   <li>arrays and collections map to {@code array}, with {@code items} when the element type is known</li>
 *   <li>maps and nested records map to {@code object}</li>
 *   <li>{@code Object} maps to an unconstrained schema</li>
 *   <li>{@code Optional<T>} maps like {@code T}, adds {@code nullable: true} and makes the argument optional</li>
 * </ul>
 */
public class SchemaDeriver {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Derives the schema for a record-declared signature.
     *
     * @throws IllegalArgumentException if a component has a type that cannot be described
     */
    public Map<String, Object> derive(Class<? extends Record> argsType) {
        return objectSchema(argsType, new HashSet<>());
    }

    /**
     * Derives the schema and applies an override on top of it.
     */
    public Map<String, Object> derive(Class<? extends Record> argsType, SchemaOverride override) {
        Map<String, Object> schema = derive(argsType);
        return override != null ? override.apply(schema) : schema;
    }

    /**
     * Reads the argument list of a record-declared signature.
     */
    public List<ArgumentSpec> arguments(Class<? extends Record> argsType) {
        if (argsType == null || !argsType.isRecord()) {
            throw new IllegalArgumentException("Tool arguments must be declared as a record: " + argsType);
        }
        List<ArgumentSpec> specs = new ArrayList<>();
        for (RecordComponent component : argsType.getRecordComponents()) {
            specs.add(toSpec(component));
        }
        return specs;
    }

    /**
     * Converts a Java identifier to snake_case ({@code maxLines} becomes {@code max_lines}).
     */
    public static String snakeCase(String identifier) {
        String step = identifier.replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2");
        step = step.replaceAll("([a-z0-9])([A-Z])", "$1_$2");
        return step.replace('-', '_').toLowerCase(Locale.ROOT);
    }

    private ArgumentSpec toSpec(RecordComponent component) {
        ToolArg annotation = component.getAnnotation(ToolArg.class);
        String name = annotation != null && !annotation.name().isBlank()
                ? annotation.name()
                : snakeCase(component.getName());
        String description = annotation != null ? annotation.description() : "";

        boolean optionalType = component.getType() == Optional.class;
        boolean optional = optionalType || (annotation != null && annotation.optional());
        boolean explicitDefault = annotation != null && !annotation.defaultValue().isEmpty();

        Object defaultValue = explicitDefault ? parseDefault(annotation.defaultValue()) : null;
        boolean hasDefault = explicitDefault || optional;
        boolean nullable = optional || (explicitDefault && defaultValue == null);
        if (nullable && component.getType().isPrimitive()) {
            throw new IllegalArgumentException("Primitive argument '" + name + "' of "
                    + component.getDeclaringRecord().getSimpleName() + " cannot be optional");
        }
        return new ArgumentSpec(name, component, !hasDefault, nullable, hasDefault, defaultValue, description);
    }

    private Object parseDefault(String literal) {
        try {
            return objectMapper.readValue(literal, Object.class);
        } catch (JsonProcessingException e) {
            return literal;
        }
    }

    private Map<String, Object> objectSchema(Class<?> recordType, Set<Class<?>> visiting) {
        @SuppressWarnings("unchecked")
        List<ArgumentSpec> specs = arguments((Class<? extends Record>) recordType);
        visiting.add(recordType);

        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ArgumentSpec spec : specs) {
            if (properties.containsKey(spec.name())) {
                throw new IllegalArgumentException("Duplicate argument name '" + spec.name() + "' in "
                        + recordType.getSimpleName());
            }
            Type type = spec.component().getGenericType();
            if (spec.component().getType() == Optional.class) {
                type = typeArgument(type, 0);
            }
            Map<String, Object> property = typeSchema(type, visiting);
            if (!spec.description().isEmpty()) {
                property.put("description", spec.description());
            }
            if (spec.nullable()) {
                property.put("nullable", true);
            }
            if (spec.hasDefault()) {
                property.put("default", spec.defaultValue());
            }
            properties.put(spec.name(), property);
            if (spec.required()) {
                required.add(spec.name());
            }
        }
        visiting.remove(recordType);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    private Map<String, Object> typeSchema(Type type, Set<Class<?>> visiting) {
        if (type instanceof WildcardType wildcard) {
            Type[] upper = wildcard.getUpperBounds();
            return typeSchema(upper.length > 0 ? upper[0] : Object.class, visiting);
        }
        if (type instanceof GenericArrayType arrayType) {
            return arraySchema(typeSchema(arrayType.getGenericComponentType(), visiting));
        }
        if (type instanceof ParameterizedType parameterized) {
            Class<?> raw = (Class<?>) parameterized.getRawType();
            if (Collection.class.isAssignableFrom(raw)) {
                Type element = parameterized.getActualTypeArguments()[0];
                return isUntyped(element) ? arraySchema(null) : arraySchema(typeSchema(element, visiting));
            }
            if (Map.class.isAssignableFrom(raw)) {
                Map<String, Object> schema = typed("object");
                Type value = parameterized.getActualTypeArguments()[1];
                if (!isUntyped(value)) {
                    schema.put("additionalProperties", typeSchema(value, visiting));
                }
                return schema;
            }
            if (raw == Optional.class) {
                Map<String, Object> schema = typeSchema(parameterized.getActualTypeArguments()[0], visiting);
                schema.put("nullable", true);
                return schema;
            }
            return typeSchema(raw, visiting);
        }
        if (type instanceof Class<?> cls) {
            return classSchema(cls, visiting);
        }
        throw new IllegalArgumentException("Unsupported argument type: " + type.getTypeName());
    }

    private Map<String, Object> classSchema(Class<?> cls, Set<Class<?>> visiting) {
        if (cls == Object.class) {
            return new LinkedHashMap<>();
        }
        if (cls == String.class || cls == CharSequence.class || cls == char.class
                || cls == Character.class || cls == UUID.class) {
            return typed("string");
        }
        if (cls == boolean.class || cls == Boolean.class) {
            return typed("boolean");
        }
        if (cls == int.class || cls == long.class || cls == short.class || cls == byte.class
                || cls == Integer.class || cls == Long.class || cls == Short.class || cls == Byte.class
                || cls == BigInteger.class) {
            return typed("integer");
        }
        if (cls == double.class || cls == float.class || cls == Double.class || cls == Float.class
                || cls == BigDecimal.class) {
            return typed("number");
        }
        if (cls.isEnum()) {
            Map<String, Object> schema = typed("string");
            List<String> values = new ArrayList<>();
            for (Object constant : cls.getEnumConstants()) {
                values.add(((Enum<?>) constant).name());
            }
            schema.put("enum", values);
            return schema;
        }
        if (cls.isArray()) {
            Class<?> component = cls.getComponentType();
            return component == Object.class ? arraySchema(null) : arraySchema(classSchema(component, visiting));
        }
        if (Collection.class.isAssignableFrom(cls)) {
            return arraySchema(null);
        }
        if (Map.class.isAssignableFrom(cls)) {
            return typed("object");
        }
        if (cls.isRecord()) {
            return visiting.contains(cls) ? typed("object") : objectSchema(cls, visiting);
        }
        throw new IllegalArgumentException("Unsupported argument type: " + cls.getName());
    }

    private static boolean isUntyped(Type type) {
        if (type == Object.class) {
            return true;
        }
        if (type instanceof WildcardType wildcard) {
            Type[] upper = wildcard.getUpperBounds();
            return upper.length == 0 || upper[0] == Object.class;
        }
        return false;
    }

    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType parameterized) {
            return parameterized.getActualTypeArguments()[index];
        }
        return Object.class;
    }

    private static Map<String, Object> arraySchema(Map<String, Object> items) {
        Map<String, Object> schema = typed("array");
        if (items != null) {
            schema.put("items", items);
        }
        return schema;
    }

    private static Map<String, Object> typed(String type) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", type);
        return schema;
    }
}
