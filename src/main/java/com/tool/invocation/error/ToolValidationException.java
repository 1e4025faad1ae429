package com.tool.invocation.error;

import java.util.List;
import java.util.Map;

/**
 * Raised when a call's arguments do not satisfy the tool's schema, or the tool is unknown.
 */
public class ToolValidationException extends ToolInvocationException {

    private final List<String> errors;

    public ToolValidationException(String message, List<String> errors) {
        this(message, errors, Map.of());
    }

    public ToolValidationException(String message, List<String> errors, Map<String, Object> details) {
        super(ErrorCategory.VALIDATION, message, ErrorOrigin.INTERNAL, false, details, null);
        this.errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public List<String> getErrors() {
        return errors;
    }
}
