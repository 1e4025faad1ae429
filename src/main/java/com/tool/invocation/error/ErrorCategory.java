package com.tool.invocation.error;

/**
 * Kind of failure a tool call ended with, independent of the exception type that carried it.
 */
public enum ErrorCategory {
    /** Bad, missing or unknown arguments, or an unknown tool. */
    VALIDATION("validation"),
    /** Mutation denied by the write-gate. */
    AUTHORIZATION("authorization"),
    /** Deadline exceeded. */
    TIMEOUT("timeout"),
    /** Failure reported by an external collaborator. */
    UPSTREAM("upstream"),
    UNKNOWN("unknown");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Validation and authorization failures are raised before the tool runs and are never retried.
     */
    public boolean isFailFast() {
        return this == VALIDATION || this == AUTHORIZATION;
    }
}
