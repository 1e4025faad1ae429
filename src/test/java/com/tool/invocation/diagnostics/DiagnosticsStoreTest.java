package com.tool.invocation.diagnostics;

import com.tool.invocation.error.ErrorCategory;
import com.tool.invocation.error.ErrorOrigin;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Diagnostics Tests")
class DiagnosticsStoreTest {

    @Nested
    @DisplayName("Redactor")
    class RedactorTests {

        @Test
        @DisplayName("Auth headers, tokens, e-mails and IPs are scrubbed")
        void scrubs() {
            String token = "ghp_" + "a1B2c3D4e5".repeat(4);
            String text = "Authorization: Bearer abc.def token=" + token
                    + " by dev@example.com from 10.0.0.12";

            String redacted = Redactor.redact(text);

            assertEquals("Authorization: Bearer [REDACTED] token=[REDACTED_TOKEN] by [REDACTED_EMAIL] from [REDACTED_IP]",
                    redacted);
        }

        @Test
        @DisplayName("Basic auth is scrubbed")
        void basicAuth() {
            assertEquals("Authorization: Basic [REDACTED]", Redactor.redact("authorization: basic dXNlcjpwYXNz"));
        }

        @Test
        @DisplayName("Nested structures are scrubbed, other values pass through")
        void nested() {
            Object redacted = Redactor.redactValue(Map.of("list", List.of("ops@example.com", 3), "ok", true));

            assertEquals(Map.of("list", List.of("[REDACTED_EMAIL]", 3), "ok", true), redacted);
            assertNull(Redactor.redact(null));
        }
    }

    @Nested
    @DisplayName("ArgumentPreview")
    class PreviewTests {

        @Test
        @DisplayName("Details carry sorted keys, count and a JSON preview")
        void details() {
            Map<String, Object> details = ArgumentPreview.details(Map.of("repo", "hello", "owner", "octo"));

            assertEquals(List.of("owner", "repo"), details.get("arg_keys"));
            assertEquals(2, details.get("arg_count"));
            String preview = (String) details.get("args_preview");
            assertTrue(preview.contains("\"owner\":\"octo\""));
        }

        @Test
        @DisplayName("Long strings and lists are cut")
        void bounded() {
            List<Integer> many = new ArrayList<>();
            for (int i = 0; i < 150; i++) {
                many.add(i);
            }

            Object boundedString = ArgumentPreview.bound("x".repeat(3_000), 0);
            Object boundedList = ArgumentPreview.bound(many, 0);

            assertTrue(((String) boundedString).endsWith("...(truncated)"));
            assertEquals(ArgumentPreview.MAX_ITEMS + 1, ((List<?>) boundedList).size());
            assertEquals("... 50 more items", ((List<?>) boundedList).get(ArgumentPreview.MAX_ITEMS));
        }

        @Test
        @DisplayName("Deep nesting is cut at the maximum depth")
        void depth() {
            Object nested = "leaf";
            for (int i = 0; i < 10; i++) {
                nested = Map.of("n", nested);
            }

            String preview = ArgumentPreview.of(Map.of("root", nested));

            assertTrue(preview.contains("...(max depth)"));
            assertFalse(preview.contains("leaf"));
        }

        @Test
        @DisplayName("Null arguments preview as an empty object")
        void nullArgs() {
            assertEquals("{}", ArgumentPreview.of(null));
        }
    }

    @Nested
    @DisplayName("DiagnosticsStore")
    class StoreTests {

        private DiagnosticRecord record(DiagnosticRecord.Kind kind, String message) {
            return DiagnosticRecord.builder(kind)
                    .callId("call-1")
                    .toolName("get_issue")
                    .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                    .status("error")
                    .message(message)
                    .category(ErrorCategory.UPSTREAM)
                    .origin(ErrorOrigin.INTERNAL)
                    .detail("args_preview", "{\"email\":\"a@b.io\"}")
                    .build();
        }

        @Test
        @DisplayName("Records are routed by kind")
        void routing() {
            DiagnosticsStore store = new DiagnosticsStore(DiagnosticsConfig.uniform(10));
            store.append(record(DiagnosticRecord.Kind.EVENT, "e"));
            store.append(record(DiagnosticRecord.Kind.LOG, "l"));
            store.append(record(DiagnosticRecord.Kind.ERROR, "x"));

            assertEquals("e", store.recentEvents(10).get(0).message());
            assertEquals("l", store.recentLogs(10).get(0).message());
            assertEquals("x", store.recentErrors(10).get(0).message());
        }

        @Test
        @DisplayName("Stored records are redacted")
        void redacted() {
            DiagnosticsStore store = new DiagnosticsStore();
            store.append(record(DiagnosticRecord.Kind.ERROR, "token ghp_" + "z".repeat(30) + " rejected"));

            DiagnosticRecord stored = store.recentErrors(1).get(0);

            assertEquals("token [REDACTED_TOKEN] rejected", stored.message());
            assertEquals("{\"email\":\"[REDACTED_EMAIL]\"}", stored.details().get("args_preview"));
        }

        @Test
        @DisplayName("Buffers evict independently and report their counters")
        void stats() {
            DiagnosticsStore store = new DiagnosticsStore(new DiagnosticsConfig(2, 10, 10));
            for (int i = 0; i < 5; i++) {
                store.append(record(DiagnosticRecord.Kind.EVENT, "e" + i));
            }
            store.append(record(DiagnosticRecord.Kind.LOG, "l"));

            @SuppressWarnings("unchecked")
            Map<String, Object> events = (Map<String, Object>) store.stats().get("events");

            assertEquals(2, events.get("size"));
            assertEquals(2, events.get("capacity"));
            assertEquals(5L, events.get("total"));
            assertEquals(3L, events.get("dropped"));
            assertEquals(1, store.logs().size());
            assertEquals(List.of("e4", "e3"), store.recentEvents(5).stream().map(DiagnosticRecord::message).toList());
        }

        @Test
        @DisplayName("toMap uses wire names")
        void toMap() {
            Map<String, Object> map = record(DiagnosticRecord.Kind.ERROR, "m").toMap();

            assertEquals("error", map.get("kind"));
            assertEquals("upstream", map.get("category"));
            assertEquals("internal", map.get("origin"));
            assertEquals("2024-01-01T00:00:00Z", map.get("timestamp"));
        }
    }
}
