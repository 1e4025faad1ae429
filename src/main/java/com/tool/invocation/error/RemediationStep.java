package com.tool.invocation.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One actionable step suggested to the caller after a failed call.
 *
 * @param kind          machine-readable step kind, e.g. {@code retry_with_longer_timeout}
 * @param action        human-readable instruction
 * @param alternateTool tool the caller should use instead or next, may be null
 */
public record RemediationStep(String kind, String action, String alternateTool) {

    public RemediationStep {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(action, "action is required");
    }

    public static RemediationStep of(String kind, String action) {
        return new RemediationStep(kind, action, null);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", kind);
        out.put("action", action);
        if (alternateTool != null) {
            out.put("tool", alternateTool);
        }
        return out;
    }
}
