package com.tool.invocation.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Table of per-tool schema overrides, keyed by tool name. Passed to the registry explicitly.
 */
public final class SchemaOverrides {

    private final Map<String, SchemaOverride> overrides;

    private SchemaOverrides(Map<String, SchemaOverride> overrides) {
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public static SchemaOverrides none() {
        return new SchemaOverrides(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SchemaOverride> forTool(String toolName) {
        return Optional.ofNullable(overrides.get(toolName));
    }

    /**
     * Applies the tool's override, if any, to a copy of {@code schema}.
     */
    public Map<String, Object> apply(String toolName, Map<String, Object> schema) {
        SchemaOverride override = overrides.get(toolName);
        return override != null ? override.apply(schema) : schema;
    }

    public int size() {
        return overrides.size();
    }

    public static class Builder {
        private final Map<String, SchemaOverride> overrides = new LinkedHashMap<>();

        /**
         * Adds an override; a second override for the same tool is chained after the first.
         */
        public Builder override(String toolName, SchemaOverride override) {
            overrides.merge(toolName, override, SchemaOverride::andThen);
            return this;
        }

        public SchemaOverrides build() {
            return new SchemaOverrides(overrides);
        }
    }
}
