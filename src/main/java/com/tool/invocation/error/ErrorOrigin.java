package com.tool.invocation.error;

/**
 * Where a failure happened: before the call reached this server's logic, or inside it.
 */
public enum ErrorOrigin {
    EXTERNAL_PLATFORM("external_platform"),
    INTERNAL("internal");

    private final String wireName;

    ErrorOrigin(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
