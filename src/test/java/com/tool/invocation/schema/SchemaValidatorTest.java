package com.tool.invocation.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaValidator Tests")
class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();
    private final SchemaDeriver deriver = new SchemaDeriver();

    enum Visibility { PUBLIC, PRIVATE }

    record CreateBranchArgs(String branch, int depth, Optional<String> fromRef, Visibility visibility,
                            List<String> labels) {}

    private final Map<String, Object> schema = deriver.derive(CreateBranchArgs.class);

    private static Map<String, Object> validArgs() {
        Map<String, Object> args = new HashMap<>();
        args.put("branch", "feature/x");
        args.put("depth", 1);
        args.put("visibility", "PUBLIC");
        args.put("labels", List.of("a", "b"));
        return args;
    }

    @Test
    @DisplayName("Conforming arguments are valid")
    void valid() {
        ValidationResult result = validator.validate(schema, validArgs());

        assertTrue(result.valid(), () -> result.errors().toString());
        assertEquals(List.of("from_ref"), result.optionalArguments());
    }

    @Nested
    @DisplayName("Argument names")
    class NameTests {

        @Test
        @DisplayName("Missing required arguments are reported")
        void missingRequired() {
            Map<String, Object> args = validArgs();
            args.remove("branch");

            ValidationResult result = validator.validate(schema, args);

            assertFalse(result.valid());
            assertEquals(List.of("branch"), result.missingRequired());
            assertTrue(result.errors().contains("branch: required argument is missing"));
        }

        @Test
        @DisplayName("Unknown arguments are reported with the closest declared name")
        void unknownWithSuggestion() {
            Map<String, Object> args = validArgs();
            args.put("dept", 2);

            ValidationResult result = validator.validate(schema, args);

            assertEquals(List.of("dept"), result.unknownArguments());
            assertEquals("depth", result.suggestions().get("dept"));
            assertTrue(result.errors().contains("dept: unknown argument"));
            assertEquals(Map.of("dept", "depth"), result.guidance().get("did_you_mean"));
        }

        @Test
        @DisplayName("An open root schema accepts undeclared arguments")
        void openRoot() {
            Map<String, Object> open = Schemas.deepCopy(schema);
            open.put("additionalProperties", true);
            Map<String, Object> args = validArgs();
            args.put("anything", "goes");

            assertTrue(validator.validate(open, args).valid());
        }
    }

    @Nested
    @DisplayName("Values")
    class ValueTests {

        @Test
        @DisplayName("Wrong types are rejected")
        void wrongType() {
            Map<String, Object> args = validArgs();
            args.put("depth", "deep");

            ValidationResult result = validator.validate(schema, args);

            assertEquals(List.of("depth: expected integer but got string"), result.errors());
        }

        @Test
        @DisplayName("Integral doubles count as integers")
        void integralDouble() {
            Map<String, Object> args = validArgs();
            args.put("depth", 3.0);
            assertTrue(validator.validate(schema, args).valid());

            args.put("depth", 3.5);
            assertFalse(validator.validate(schema, args).valid());
        }

        @Test
        @DisplayName("Null is accepted only for nullable arguments")
        void nulls() {
            Map<String, Object> args = validArgs();
            args.put("from_ref", null);
            assertTrue(validator.validate(schema, args).valid());

            args.put("branch", null);
            assertEquals(List.of("branch: null is not allowed"), validator.validate(schema, args).errors());
        }

        @Test
        @DisplayName("Enum membership is enforced")
        void enums() {
            Map<String, Object> args = validArgs();
            args.put("visibility", "INTERNAL");

            ValidationResult result = validator.validate(schema, args);

            assertEquals(1, result.errors().size());
            assertTrue(result.errors().get(0).startsWith("visibility: value INTERNAL is not one of"));
        }

        @Test
        @DisplayName("Array items are checked with their index")
        void arrayItems() {
            Map<String, Object> args = validArgs();
            args.put("labels", List.of("ok", 7));

            assertEquals(List.of("labels[1]: expected string but got integer"),
                    validator.validate(schema, args).errors());
        }
    }

    @Test
    @DisplayName("toMap exposes validity, errors and guidance")
    void toMap() {
        Map<String, Object> out = validator.validate(schema, Map.of()).toMap();

        assertEquals(Boolean.FALSE, out.get("valid"));
        assertEquals(List.of("branch", "depth", "visibility", "labels"), out.get("missing_required"));
        assertEquals(List.of("branch", "depth", "visibility", "labels"), out.get("required_args"));
        assertEquals(List.of("from_ref"), out.get("optional_args"));
    }
}
