package com.tool.invocation.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured failure returned to the transport instead of a raw exception.
 *
 * @param category         failure kind
 * @param origin           failure origin
 * @param message          single-line failure message
 * @param tool             name of the tool that was called
 * @param callId           id of the failed call
 * @param retryable        whether an identical retry may succeed
 * @param remediationSteps ordered, actionable next steps
 * @param details          extra machine-readable context (validation errors, suggestions, ...)
 */
public record ToolErrorPayload(
        ErrorCategory category,
        ErrorOrigin origin,
        String message,
        String tool,
        String callId,
        boolean retryable,
        List<RemediationStep> remediationSteps,
        Map<String, Object> details
) {

    public ToolErrorPayload {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(origin, "origin is required");
        remediationSteps = remediationSteps != null ? List.copyOf(remediationSteps) : List.of();
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    /**
     * Wire shape: {@code {category, origin, message, tool, call_id, retryable, remediation_steps[], details}}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("category", category.wireName());
        out.put("origin", origin.wireName());
        out.put("message", message);
        out.put("tool", tool);
        out.put("call_id", callId);
        out.put("retryable", retryable);
        List<Map<String, Object>> steps = new ArrayList<>(remediationSteps.size());
        for (RemediationStep step : remediationSteps) {
            steps.add(step.toMap());
        }
        out.put("remediation_steps", steps);
        if (!details.isEmpty()) {
            out.put("details", details);
        }
        return out;
    }
}
