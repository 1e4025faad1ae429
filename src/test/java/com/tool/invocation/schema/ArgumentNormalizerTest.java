package com.tool.invocation.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArgumentNormalizer Tests")
class ArgumentNormalizerTest {

    private final ArgumentNormalizer normalizer = new ArgumentNormalizer();
    private final Map<String, Object> schema = new SchemaDeriver().derive(GetFileArgs.class);

    record GetFileArgs(String owner, String repo, String filePath, @ToolArg(optional = true) String ref) {}

    @Test
    @DisplayName("camelCase keys are renamed to the declared snake_case property")
    void camelCaseAlias() {
        Map<String, Object> out = normalizer.normalize(schema,
                Map.of("owner", "o", "repo", "r", "filePath", "README.md"));

        assertEquals(Map.of("owner", "o", "repo", "r", "file_path", "README.md"), out);
    }

    @Test
    @DisplayName("The canonical spelling wins when both are given")
    void canonicalWins() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("file_path", "a.txt");
        args.put("filePath", "b.txt");

        Map<String, Object> out = normalizer.normalize(schema, args);

        assertEquals("a.txt", out.get("file_path"));
        assertEquals("b.txt", out.get("filePath"));
    }

    @Test
    @DisplayName("A compound owner/repo identifier is split")
    void splitFullName() {
        Map<String, Object> out = normalizer.normalize(schema,
                Map.of("full_name", "octo/hello", "file_path", "x"));

        assertEquals("octo", out.get("owner"));
        assertEquals("hello", out.get("repo"));
        assertFalse(out.containsKey("full_name"));
    }

    @Test
    @DisplayName("No split when owner or repo was given explicitly")
    void noSplitWhenExplicit() {
        Map<String, Object> out = normalizer.normalize(schema,
                Map.of("repository", "octo/hello", "owner", "someone", "file_path", "x"));

        assertEquals("octo/hello", out.get("repository"));
        assertEquals("someone", out.get("owner"));
        assertFalse(out.containsKey("repo"));
    }

    @Test
    @DisplayName("Malformed compound values are left alone for validation to reject")
    void malformedCompound() {
        Map<String, Object> out = normalizer.normalize(schema, Map.of("full_name", "no-slash"));

        assertEquals(Map.of("full_name", "no-slash"), out);
    }

    @Test
    @DisplayName("Values are never coerced")
    void valuesUntouched() {
        Map<String, Object> out = normalizer.normalize(schema, Map.of("owner", 42, "repo", "r", "file_path", "x"));

        assertEquals(42, out.get("owner"));
    }
}
