package com.tool.invocation.tool;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.tool.invocation.schema.ArgumentSpec;
import com.tool.invocation.schema.SchemaDeriver;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized, validated arguments of one call, as handed to a tool implementation.
 */
public final class ToolArguments {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final SchemaDeriver DERIVER = new SchemaDeriver();

    private final String callId;
    private final String toolName;
    private final Map<String, Object> values;

    public ToolArguments(String callId, String toolName, Map<String, Object> values) {
        this.callId = callId;
        this.toolName = Objects.requireNonNull(toolName, "toolName is required");
        this.values = values != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(values))
                : Map.of();
    }

    public String callId() {
        return callId;
    }

    public String toolName() {
        return toolName;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public Optional<String> getString(String name) {
        Object value = values.get(name);
        return value != null ? Optional.of(String.valueOf(value)) : Optional.empty();
    }

    public String requireString(String name) {
        return getString(name).orElseThrow(() -> new IllegalArgumentException("Missing argument: " + name));
    }

    /**
     * Binds the arguments to the record that declares the tool's signature. Absent arguments take
     * their declared default; {@code Optional} components receive {@code Optional.empty()}.
     *
     * @throws IllegalArgumentException if a value cannot be converted or a required primitive is absent
     */
    public <R extends Record> R as(Class<R> argsType) {
        List<ArgumentSpec> specs = DERIVER.arguments(argsType);
        Class<?>[] parameterTypes = new Class<?>[specs.size()];
        Object[] parameters = new Object[specs.size()];
        for (int i = 0; i < specs.size(); i++) {
            ArgumentSpec spec = specs.get(i);
            RecordComponent component = spec.component();
            parameterTypes[i] = component.getType();
            Object raw = values.containsKey(spec.name()) ? values.get(spec.name()) : spec.defaultValue();
            parameters[i] = bind(spec, component, raw);
        }
        try {
            Constructor<R> constructor = argsType.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return constructor.newInstance(parameters);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalArgumentException("Cannot bind arguments to " + argsType.getSimpleName(), cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot construct " + argsType.getSimpleName(), e);
        }
    }

    private Object bind(ArgumentSpec spec, RecordComponent component, Object raw) {
        if (component.getType() == Optional.class) {
            Type inner = component.getGenericType() instanceof ParameterizedType p
                    ? p.getActualTypeArguments()[0]
                    : Object.class;
            return Optional.ofNullable(convert(spec.name(), raw, inner));
        }
        Object converted = convert(spec.name(), raw, component.getGenericType());
        if (converted == null && component.getType().isPrimitive()) {
            throw new IllegalArgumentException("Missing argument: " + spec.name());
        }
        return converted;
    }

    private static Object convert(String name, Object raw, Type type) {
        if (raw == null) {
            return null;
        }
        try {
            JavaType javaType = MAPPER.getTypeFactory().constructType(type);
            return MAPPER.convertValue(raw, javaType);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for argument '" + name + "': " + raw, e);
        }
    }

    @Override
    public String toString() {
        return "ToolArguments{tool=" + toolName + ", callId=" + callId + ", keys=" + values.keySet() + "}";
    }
}
