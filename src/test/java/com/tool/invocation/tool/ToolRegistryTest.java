package com.tool.invocation.tool;

import com.tool.invocation.schema.SchemaDeriver;
import com.tool.invocation.schema.SchemaOverride;
import com.tool.invocation.schema.SchemaOverrides;
import com.tool.invocation.schema.Schemas;
import com.tool.invocation.schema.ToolArg;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ToolRegistry Tests")
class ToolRegistryTest {

    record IssueArgs(String owner, String repo, String title) {}

    record IssueArgsWithDefault(String owner, String repo, @ToolArg(defaultValue = "\"untitled\"") String title) {}

    private static ToolDescriptor tool(String name) {
        return ToolDescriptor.builder(name)
                .arguments(IssueArgs.class)
                .handler(args -> name)
                .build();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Exact duplicates are rejected")
        void duplicateRejected() {
            ToolRegistry registry = new ToolRegistry();
            registry.register(tool("create_issue"));

            DuplicateToolException e = assertThrows(DuplicateToolException.class,
                    () -> registry.register(tool("create_issue")));
            assertEquals("create_issue", e.getToolName());
            assertEquals(1, registry.size());
        }

        @Test
        @DisplayName("Names differing only in case may coexist")
        void caseVariantsAllowed() {
            ToolRegistry registry = new ToolRegistry();
            registry.register(tool("Foo"));
            registry.register(tool("foo"));

            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("list is sorted by name")
        void listSorted() {
            ToolRegistry registry = new ToolRegistry();
            registry.register(tool("zeta"));
            registry.register(tool("alpha"));
            registry.register(tool("mid"));

            assertEquals(List.of("alpha", "mid", "zeta"), registry.list().stream().map(ToolDescriptor::name).toList());
        }

        @Test
        @DisplayName("The configured override is applied at registration")
        void overrideApplied() {
            ToolRegistry registry = new ToolRegistry(SchemaOverrides.builder()
                    .override("create_issue", SchemaOverride.makeOptional("title"))
                    .build());

            ToolDescriptor registered = registry.register(tool("create_issue"));

            assertEquals(List.of("owner", "repo"), Schemas.required(registered.schema()));
        }
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        private final ToolRegistry registry = new ToolRegistry();

        LookupTests() {
            registry.register(tool("create_issue"));
            registry.register(tool("get_file_contents"));
        }

        @Test
        @DisplayName("Exact names resolve")
        void exact() {
            assertEquals("create_issue", registry.find("create_issue").map(ToolDescriptor::name).orElse(null));
        }

        @Test
        @DisplayName("Case, separators, leading slashes and qualifiers are tolerated")
        void tolerantVariants() {
            for (String variant : List.of("CREATE_ISSUE", "create-issue", "createIssue", "/create_issue",
                    "github.create_issue", "tools:create_issue", "tools/createIssue")) {
                assertEquals(Optional.of("create_issue"), registry.find(variant).map(ToolDescriptor::name), variant);
            }
        }

        @Test
        @DisplayName("Unknown and blank names resolve to nothing")
        void unknown() {
            assertTrue(registry.find("delete_repository").isEmpty());
            assertTrue(registry.find("").isEmpty());
            assertTrue(registry.find(null).isEmpty());
        }

        @Test
        @DisplayName("Unknown names get the closest suggestion")
        void suggestion() {
            assertEquals(Optional.of("create_issue"), registry.suggest("create_isue"));
            assertTrue(registry.suggest("xyz").isEmpty());
        }
    }

    @Nested
    @DisplayName("Ambiguity")
    class AmbiguityTests {

        @Test
        @DisplayName("A canonical form shared by two tools is never guessed")
        void canonicalAmbiguity() {
            ToolRegistry registry = new ToolRegistry();
            registry.register(tool("create_issue"));
            registry.register(tool("createIssue"));

            assertTrue(registry.find("create-issue").isEmpty());
            assertEquals("create_issue", registry.find("create_issue").orElseThrow().name());
            assertEquals("createIssue", registry.find("createIssue").orElseThrow().name());
        }

        @Test
        @DisplayName("A case-insensitive match shared by two tools is never guessed")
        void caseAmbiguity() {
            ToolRegistry registry = new ToolRegistry();
            registry.register(tool("Foo"));
            registry.register(tool("foo"));

            assertTrue(registry.find("FOO").isEmpty());
        }
    }

    @Nested
    @DisplayName("Republishing")
    class RepublishTests {

        private final SchemaDeriver deriver = new SchemaDeriver();

        @Test
        @DisplayName("An unchanged schema is not republished")
        void unchanged() {
            ToolRegistry registry = new ToolRegistry();
            ToolDescriptor descriptor = registry.register(tool("create_issue"));
            String hash = descriptor.schemaHash();

            assertFalse(registry.republishIfChanged("create_issue", deriver.derive(IssueArgs.class)));
            assertEquals(hash, descriptor.schemaHash());
        }

        @Test
        @DisplayName("A new default is republished on the same descriptor")
        void defaultAdded() {
            ToolRegistry registry = new ToolRegistry();
            ToolDescriptor descriptor = registry.register(tool("create_issue"));
            String hash = descriptor.schemaHash();

            assertTrue(registry.republishIfChanged("create_issue", deriver.derive(IssueArgsWithDefault.class)));

            assertSame(descriptor, registry.find("create_issue").orElseThrow());
            assertNotEquals(hash, descriptor.schemaHash());
            assertEquals(List.of("owner", "repo"), Schemas.required(descriptor.schema()));
        }

        @Test
        @DisplayName("Republishing an unknown tool fails")
        void unknownTool() {
            ToolRegistry registry = new ToolRegistry();
            Map<String, Object> schema = Schemas.emptyObject();
            assertThrows(IllegalArgumentException.class, () -> registry.republishIfChanged("nope", schema));
        }
    }
}
