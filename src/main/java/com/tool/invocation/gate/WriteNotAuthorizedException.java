package com.tool.invocation.gate;

import com.tool.invocation.error.ErrorCategory;
import com.tool.invocation.error.ErrorOrigin;
import com.tool.invocation.error.ToolInvocationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised before a mutating tool runs when the write gate denies the call.
 */
public class WriteNotAuthorizedException extends ToolInvocationException {

    private final String toolName;
    private final WriteGateDecision decision;

    public WriteNotAuthorizedException(String toolName, WriteGateDecision decision, String protectedRef) {
        super(ErrorCategory.AUTHORIZATION, message(toolName, decision, protectedRef),
                ErrorOrigin.INTERNAL, false, details(decision, protectedRef), null);
        this.toolName = toolName;
        this.decision = decision;
    }

    public String getToolName() {
        return toolName;
    }

    public WriteGateDecision getDecision() {
        return decision;
    }

    private static String message(String toolName, WriteGateDecision decision, String protectedRef) {
        if (decision.targetRef() == null) {
            return "Write not authorized: '" + toolName + "' has no target ref; call authorize_mutations first";
        }
        return "Write not authorized: '" + toolName + "' targets protected ref '" + protectedRef
                + "'; call authorize_mutations or target a different branch";
    }

    private static Map<String, Object> details(WriteGateDecision decision, String protectedRef) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target_ref", decision.targetRef());
        details.put("protected_ref", protectedRef);
        details.put("reason", decision.reason());
        return details;
    }
}
