package com.tool.invocation.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaOverride Tests")
class SchemaOverrideTest {

    private final SchemaDeriver deriver = new SchemaDeriver();

    record EditArgs(String path, int line, String labels) {}

    @SuppressWarnings("unchecked")
    private static Map<String, Object> property(Map<String, Object> schema, String name) {
        return (Map<String, Object>) Schemas.properties(schema).get(name);
    }

    @Nested
    @DisplayName("Built-in overrides")
    class BuiltInTests {

        @Test
        @DisplayName("widenType accepts several types")
        void widenType() {
            Map<String, Object> schema = SchemaOverride.widenType("line", "integer", "string")
                    .apply(deriver.derive(EditArgs.class));

            assertEquals(List.of("integer", "string"), property(schema, "line").get("type"));
        }

        @Test
        @DisplayName("stringArray forces array of strings")
        void stringArray() {
            Map<String, Object> schema = SchemaOverride.stringArray("labels").apply(deriver.derive(EditArgs.class));

            assertEquals(Map.of("type", "array", "items", Map.of("type", "string")), property(schema, "labels"));
        }

        @Test
        @DisplayName("makeOptional removes the argument from required and defaults it to null")
        void makeOptional() {
            Map<String, Object> schema = SchemaOverride.makeOptional("path").apply(deriver.derive(EditArgs.class));

            assertEquals(List.of("line", "labels"), Schemas.required(schema));
            assertEquals(Boolean.TRUE, property(schema, "path").get("nullable"));
            assertTrue(property(schema, "path").containsKey("default"));
        }

        @Test
        @DisplayName("replace discards the derived schema")
        void replace() {
            Map<String, Object> replacement = Schemas.emptyObject();
            replacement.put("additionalProperties", true);

            Map<String, Object> schema = SchemaOverride.replace(replacement).apply(deriver.derive(EditArgs.class));

            assertEquals(replacement, schema);
        }

        @Test
        @DisplayName("Overriding an undeclared property fails")
        void missingProperty() {
            Map<String, Object> derived = deriver.derive(EditArgs.class);
            SchemaOverride override = SchemaOverride.widenType("column", "integer", "string");
            assertThrows(IllegalArgumentException.class, () -> override.apply(derived));
        }
    }

    @Test
    @DisplayName("apply never modifies its argument")
    void applyWorksOnCopy() {
        Map<String, Object> derived = deriver.derive(EditArgs.class);
        Map<String, Object> before = Schemas.deepCopy(derived);

        SchemaOverride.makeOptional("path").andThen(SchemaOverride.widenType("line", "integer", "string"))
                .apply(derived);

        assertEquals(before, derived);
    }

    @Nested
    @DisplayName("SchemaOverrides table")
    class TableTests {

        @Test
        @DisplayName("Two overrides for one tool are chained in registration order")
        void chained() {
            SchemaOverrides overrides = SchemaOverrides.builder()
                    .override("edit_file", SchemaOverride.makeOptional("path"))
                    .override("edit_file", SchemaOverride.widenType("line", "integer", "string"))
                    .build();

            Map<String, Object> schema = overrides.apply("edit_file", deriver.derive(EditArgs.class));

            assertEquals(1, overrides.size());
            assertFalse(Schemas.required(schema).contains("path"));
            assertEquals(List.of("integer", "string"), property(schema, "line").get("type"));
        }

        @Test
        @DisplayName("Tools without an override get the schema unchanged")
        void noOverride() {
            Map<String, Object> derived = deriver.derive(EditArgs.class);

            assertSame(derived, SchemaOverrides.none().apply("edit_file", derived));
            assertTrue(SchemaOverrides.none().forTool("edit_file").isEmpty());
        }
    }
}
