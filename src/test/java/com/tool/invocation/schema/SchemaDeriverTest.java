package com.tool.invocation.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaDeriver Tests")
class SchemaDeriverTest {

    private final SchemaDeriver deriver = new SchemaDeriver();

    record EchoArgs(int value) {}

    enum Mode { FAST, SAFE }

    record Author(String name, @ToolArg(optional = true) String email) {}

    record CommitArgs(
            @ToolArg(description = "Repository owner") String owner,
            String repo,
            Optional<String> branch,
            @ToolArg(defaultValue = "10") Integer maxLines,
            @ToolArg(name = "message_text") String message,
            Mode mode,
            List<String> paths,
            Set<Integer> lineNumbers,
            Map<String, Boolean> flags,
            Author author,
            Object payload) {}

    record BadOptionalPrimitive(@ToolArg(optional = true) int count) {}

    record UnsupportedArgs(Thread thread) {}

    @SuppressWarnings("unchecked")
    private static Map<String, Object> property(Map<String, Object> schema, String name) {
        return (Map<String, Object>) Schemas.properties(schema).get(name);
    }

    @Nested
    @DisplayName("Basic derivation")
    class BasicTests {

        @Test
        @DisplayName("echo(value: integer) derives the documented schema")
        void echoSchema() {
            Map<String, Object> schema = deriver.derive(EchoArgs.class);

            assertEquals(Map.of(
                    "type", "object",
                    "properties", Map.of("value", Map.of("type", "integer")),
                    "required", List.of("value")), schema);
        }

        @Test
        @DisplayName("Deriving twice yields identical output and hash")
        void idempotent() {
            Map<String, Object> first = deriver.derive(CommitArgs.class);
            Map<String, Object> second = deriver.derive(CommitArgs.class);

            assertEquals(first, second);
            assertEquals(Schemas.canonicalJson(first), Schemas.canonicalJson(second));
            assertEquals(Schemas.hash(first), Schemas.hash(second));
        }

        @Test
        @DisplayName("Properties keep record component order")
        void componentOrder() {
            Map<String, Object> schema = deriver.derive(CommitArgs.class);

            assertEquals(List.of("owner", "repo", "branch", "max_lines", "message_text", "mode",
                    "paths", "line_numbers", "flags", "author", "payload"),
                    List.copyOf(Schemas.properties(schema).keySet()));
        }
    }

    @Nested
    @DisplayName("Required and optional arguments")
    class OptionalityTests {

        @Test
        @DisplayName("Optional components are nullable with a null default")
        void optionalComponent() {
            Map<String, Object> schema = deriver.derive(CommitArgs.class);
            Map<String, Object> branch = property(schema, "branch");

            assertEquals("string", branch.get("type"));
            assertEquals(Boolean.TRUE, branch.get("nullable"));
            assertTrue(branch.containsKey("default"));
            assertNull(branch.get("default"));
            assertFalse(Schemas.required(schema).contains("branch"));
        }

        @Test
        @DisplayName("Declared defaults are parsed as JSON and make the argument optional")
        void declaredDefault() {
            Map<String, Object> schema = deriver.derive(CommitArgs.class);
            Map<String, Object> maxLines = property(schema, "max_lines");

            assertEquals("integer", maxLines.get("type"));
            assertEquals(10, maxLines.get("default"));
            assertFalse(maxLines.containsKey("nullable"));
            assertFalse(Schemas.required(schema).contains("max_lines"));
        }

        @Test
        @DisplayName("Plain components are required")
        void requiredComponents() {
            List<String> required = Schemas.required(deriver.derive(CommitArgs.class));

            assertTrue(required.containsAll(List.of("owner", "repo", "message_text", "mode", "author")));
        }

        @Test
        @DisplayName("A primitive cannot be optional")
        void primitiveOptionalRejected() {
            assertThrows(IllegalArgumentException.class, () -> deriver.derive(BadOptionalPrimitive.class));
        }
    }

    @Nested
    @DisplayName("Type mapping")
    class TypeMappingTests {

        private final Map<String, Object> schema = deriver.derive(CommitArgs.class);

        @Test
        @DisplayName("Descriptions are carried over")
        void description() {
            assertEquals("Repository owner", property(schema, "owner").get("description"));
        }

        @Test
        @DisplayName("Enums map to string with enum values")
        void enums() {
            Map<String, Object> mode = property(schema, "mode");
            assertEquals("string", mode.get("type"));
            assertEquals(List.of("FAST", "SAFE"), mode.get("enum"));
        }

        @Test
        @DisplayName("Collections map to arrays with typed items")
        void collections() {
            assertEquals(Map.of("type", "array", "items", Map.of("type", "string")), property(schema, "paths"));
            assertEquals(Map.of("type", "array", "items", Map.of("type", "integer")),
                    property(schema, "line_numbers"));
        }

        @Test
        @DisplayName("Maps map to objects with typed additionalProperties")
        void maps() {
            assertEquals(Map.of("type", "object", "additionalProperties", Map.of("type", "boolean")),
                    property(schema, "flags"));
        }

        @Test
        @DisplayName("Nested records map to nested object schemas")
        void nestedRecord() {
            Map<String, Object> author = property(schema, "author");
            assertEquals("object", author.get("type"));
            assertEquals(List.of("name"), author.get("required"));
            assertTrue(Schemas.properties(author).containsKey("email"));
        }

        @Test
        @DisplayName("Object maps to an unconstrained schema")
        void object() {
            assertTrue(property(schema, "payload").isEmpty());
        }

        @Test
        @DisplayName("Unsupported types are rejected")
        void unsupported() {
            assertThrows(IllegalArgumentException.class, () -> deriver.derive(UnsupportedArgs.class));
        }
    }

    @Nested
    @DisplayName("snakeCase")
    class SnakeCaseTests {

        @Test
        @DisplayName("Converts camelCase and acronyms")
        void conversions() {
            assertEquals("max_lines", SchemaDeriver.snakeCase("maxLines"));
            assertEquals("http_status", SchemaDeriver.snakeCase("HTTPStatus"));
            assertEquals("file_path2", SchemaDeriver.snakeCase("filePath2"));
            assertEquals("already_snake", SchemaDeriver.snakeCase("already_snake"));
        }
    }

    @Test
    @DisplayName("derive with override patches a copy")
    void deriveWithOverride() {
        Map<String, Object> schema = deriver.derive(EchoArgs.class, SchemaOverride.widenType("value", "integer", "string"));

        assertEquals(List.of("integer", "string"), property(schema, "value").get("type"));
        assertEquals("integer", property(deriver.derive(EchoArgs.class), "value").get("type"));
    }
}
