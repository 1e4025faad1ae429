package com.tool.invocation.error;

import java.util.Objects;

/**
 * Result of classifying a failure.
 *
 * @param category  failure kind
 * @param origin    failure origin
 * @param message   single-line message describing the failure
 * @param retryable whether an identical retry may succeed
 */
public record Classification(ErrorCategory category, ErrorOrigin origin, String message, boolean retryable) {

    public Classification {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(origin, "origin is required");
        message = message != null ? message : "";
    }
}
