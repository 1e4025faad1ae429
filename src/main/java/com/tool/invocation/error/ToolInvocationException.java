package com.tool.invocation.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for failures raised by the invocation core or by tool implementations
 * that want to control how the failure is classified.
 *
 * <p>The category is fixed per subclass; an origin hint, when present, overrides the
 * message-based origin heuristic of {@link ErrorClassifier}.</p>
 */
public class ToolInvocationException extends RuntimeException {

    private final ErrorCategory category;
    private final ErrorOrigin originHint;
    private final boolean retryable;
    private final Map<String, Object> details;

    public ToolInvocationException(ErrorCategory category, String message) {
        this(category, message, null, false, null, null);
    }

    public ToolInvocationException(ErrorCategory category, String message, ErrorOrigin originHint,
                                   boolean retryable, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.originHint = originHint;
        this.retryable = retryable;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public ErrorOrigin getOriginHint() {
        return originHint;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
