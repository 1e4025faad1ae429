package com.tool.invocation.tool;

import com.tool.invocation.schema.SchemaDeriver;
import com.tool.invocation.schema.Schemas;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A registered tool: its name, implementation, input schema and classification flags.
 *
 * <p>The name and implementation never change after construction. The published schema may be
 * replaced by the registry when a re-derived schema differs from it; the descriptor itself is
 * never swapped out.</p>
 */
public final class ToolDescriptor {

    public enum Visibility { PUBLIC, HIDDEN }

    private final String name;
    private final String description;
    private final boolean mutating;
    private final boolean deduplicated;
    private final Visibility visibility;
    private final Set<String> tags;
    private final ToolHandler handler;
    private final AsyncToolHandler asyncHandler;
    private final Class<? extends Record> argsType;

    private volatile PublishedSchema published;

    private ToolDescriptor(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.mutating = builder.mutating;
        this.deduplicated = builder.deduplicated;
        this.visibility = builder.visibility;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.handler = builder.handler;
        this.asyncHandler = builder.asyncHandler;
        this.argsType = builder.argsType;
        this.published = PublishedSchema.of(builder.schema);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public boolean mutating() {
        return mutating;
    }

    /**
     * Whether concurrent identical calls are coalesced. Off for tools that must always return fresh state.
     */
    public boolean deduplicated() {
        return deduplicated;
    }

    public Visibility visibility() {
        return visibility;
    }

    public Set<String> tags() {
        return tags;
    }

    public boolean isAsync() {
        return asyncHandler != null;
    }

    public ToolHandler handler() {
        return handler;
    }

    public AsyncToolHandler asyncHandler() {
        return asyncHandler;
    }

    /**
     * Record type the arguments bind to, or null when the tool was registered with an explicit schema.
     */
    public Class<? extends Record> argsType() {
        return argsType;
    }

    /**
     * Copy of the currently published input schema.
     */
    public Map<String, Object> schema() {
        return Schemas.deepCopy(published.schema());
    }

    /**
     * SHA-256 of the canonical JSON form of the published schema.
     */
    public String schemaHash() {
        return published.hash();
    }

    /**
     * Required and declared argument names plus the schema hash, used in tool listings.
     */
    public Map<String, Object> schemaSummary() {
        Map<String, Object> schema = published.schema();
        return Map.of(
                "required", Schemas.required(schema),
                "properties", Schemas.properties(schema).keySet().stream().toList(),
                "schema_hash", published.hash());
    }

    Map<String, Object> publishedSchema() {
        return published.schema();
    }

    void publish(Map<String, Object> schema) {
        this.published = PublishedSchema.of(schema);
    }

    @Override
    public String toString() {
        return "ToolDescriptor{name=" + name + ", mutating=" + mutating + ", async=" + isAsync() + "}";
    }

    private record PublishedSchema(Map<String, Object> schema, String hash) {
        static PublishedSchema of(Map<String, Object> schema) {
            Map<String, Object> copy = Schemas.deepCopy(schema);
            return new PublishedSchema(copy, Schemas.hash(copy));
        }
    }

    public static class Builder {
        private final String name;
        private String description = "";
        private boolean mutating;
        private boolean deduplicated = true;
        private Visibility visibility = Visibility.PUBLIC;
        private final Set<String> tags = new LinkedHashSet<>();
        private ToolHandler handler;
        private AsyncToolHandler asyncHandler;
        private Class<? extends Record> argsType;
        private Map<String, Object> schema;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder mutating(boolean mutating) {
            this.mutating = mutating;
            return this;
        }

        public Builder deduplicated(boolean deduplicated) {
            this.deduplicated = deduplicated;
            return this;
        }

        public Builder visibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        /**
         * Declares the argument record; the schema is derived from it unless {@link #schema(Map)} is set.
         */
        public Builder arguments(Class<? extends Record> argsType) {
            this.argsType = argsType;
            return this;
        }

        public Builder schema(Map<String, Object> schema) {
            this.schema = schema;
            return this;
        }

        public Builder handler(ToolHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder asyncHandler(AsyncToolHandler asyncHandler) {
            this.asyncHandler = asyncHandler;
            return this;
        }

        public ToolDescriptor build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Tool name is required");
            }
            if ((handler == null) == (asyncHandler == null)) {
                throw new IllegalArgumentException("Tool '" + name + "' needs exactly one of handler or asyncHandler");
            }
            Objects.requireNonNull(visibility, "visibility is required");
            if (schema == null) {
                schema = argsType != null ? new SchemaDeriver().derive(argsType) : Schemas.emptyObject();
            }
            return new ToolDescriptor(this);
        }
    }
}
