package com.tool.invocation.error;

import java.time.Duration;
import java.util.Map;

/**
 * Raised when a call exceeded its deadline and was cancelled by the dispatcher.
 */
public class ToolTimeoutException extends ToolInvocationException {

    private final Duration timeout;

    public ToolTimeoutException(String toolName, Duration timeout) {
        super(ErrorCategory.TIMEOUT,
                "Tool '" + toolName + "' did not complete within " + timeout.toMillis() + "ms",
                ErrorOrigin.INTERNAL, true, Map.of("timeout_ms", timeout.toMillis()), null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
