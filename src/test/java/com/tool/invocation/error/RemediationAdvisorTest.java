package com.tool.invocation.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RemediationAdvisor Tests")
class RemediationAdvisorTest {

    private final RemediationAdvisor advisor = new RemediationAdvisor(Map.of("create_pull_request", "local_git_push"));

    private static List<String> kinds(List<RemediationStep> steps) {
        return steps.stream().map(RemediationStep::kind).toList();
    }

    @Test
    @DisplayName("Validation failures point at the schema and a dry run")
    void validation() {
        List<RemediationStep> steps = advisor.advise(ErrorCategory.VALIDATION, ErrorOrigin.INTERNAL, "create_issue");

        assertEquals(List.of("fetch_schema", "validate_arguments"), kinds(steps));
        assertEquals("describe_tool", steps.get(0).alternateTool());
        assertEquals("validate_args", steps.get(1).alternateTool());
    }

    @Test
    @DisplayName("Authorization failures suggest a feature branch or authorization")
    void authorization() {
        List<RemediationStep> steps = advisor.advise(ErrorCategory.AUTHORIZATION, ErrorOrigin.INTERNAL, "create_file");

        assertEquals(List.of("target_unprotected_ref", "authorize_mutations"), kinds(steps));
    }

    @Test
    @DisplayName("Timeouts suggest a longer timeout first")
    void timeout() {
        List<RemediationStep> steps = advisor.advise(ErrorCategory.TIMEOUT, ErrorOrigin.INTERNAL, "search_code");

        assertEquals("retry_with_longer_timeout", steps.get(0).kind());
        assertEquals(List.of("retry_with_longer_timeout", "reduce_scope"), kinds(steps));
    }

    @Test
    @DisplayName("Upstream failures of a tool with a local fallback recommend the fallback first")
    void upstreamWithFallback() {
        List<RemediationStep> steps = advisor.advise(ErrorCategory.UPSTREAM, ErrorOrigin.INTERNAL,
                "create_pull_request");

        assertEquals(List.of("use_local_fallback", "retry_with_backoff", "inspect_recent_errors"), kinds(steps));
        assertEquals("local_git_push", steps.get(0).alternateTool());
    }

    @Test
    @DisplayName("Upstream failures without a fallback suggest backoff")
    void upstreamWithoutFallback() {
        List<RemediationStep> steps = advisor.advise(ErrorCategory.UPSTREAM, ErrorOrigin.INTERNAL, "get_issue");

        assertEquals(List.of("retry_with_backoff", "inspect_recent_errors"), kinds(steps));
    }

    @Test
    @DisplayName("Platform rejections lead with the fallback and a safe retry, without repeating the fallback")
    void externalPlatform() {
        List<RemediationStep> steps = advisor.advise(ErrorCategory.UPSTREAM, ErrorOrigin.EXTERNAL_PLATFORM,
                "create_pull_request");

        assertEquals(List.of("use_local_fallback", "retry_unchanged", "retry_with_backoff", "inspect_recent_errors"),
                kinds(steps));
    }

    @Test
    @DisplayName("Unknown failures point at diagnostics")
    void unknown() {
        List<RemediationStep> steps = new RemediationAdvisor().advise(ErrorCategory.UNKNOWN, ErrorOrigin.INTERNAL, null);

        assertEquals(List.of("inspect_recent_errors", "report_issue"), kinds(steps));
    }

    @Test
    @DisplayName("The payload wire shape uses snake_case keys and omits empty details")
    void payloadShape() {
        ToolErrorPayload payload = new ToolErrorPayload(ErrorCategory.TIMEOUT, ErrorOrigin.INTERNAL,
                "too slow", "search_code", "call-7", true,
                List.of(RemediationStep.of("reduce_scope", "Narrow the request")), null);

        Map<String, Object> map = payload.toMap();

        assertEquals("timeout", map.get("category"));
        assertEquals("internal", map.get("origin"));
        assertEquals("call-7", map.get("call_id"));
        assertEquals(true, map.get("retryable"));
        assertEquals(List.of(Map.of("kind", "reduce_scope", "action", "Narrow the request")),
                map.get("remediation_steps"));
        assertFalse(map.containsKey("details"));
    }

    @Test
    @DisplayName("Fail-fast categories")
    void failFast() {
        assertTrue(ErrorCategory.VALIDATION.isFailFast());
        assertTrue(ErrorCategory.AUTHORIZATION.isFailFast());
        assertFalse(ErrorCategory.UPSTREAM.isFailFast());
    }
}
