package com.tool.invocation.gate;

import java.util.Objects;

/**
 * Process-wide write authorization toggle plus the name of the protected ref.
 *
 * <p>{@code allowed} is volatile: a change is visible to every call dispatched after it, but a call
 * already past its gate check is not affected. The gate is advisory; the credential scope of the
 * downstream API remains the real enforcement point.</p>
 */
public class WriteGateState {

    private volatile boolean allowed;
    private final String protectedRef;

    public WriteGateState(boolean allowed, String protectedRef) {
        if (protectedRef == null || protectedRef.isBlank()) {
            throw new IllegalArgumentException("protectedRef is required");
        }
        this.allowed = allowed;
        this.protectedRef = WriteGate.normalizeRef(protectedRef);
    }

    public static WriteGateState defaults() {
        return new WriteGateState(false, "main");
    }

    public boolean isAllowed() {
        return allowed;
    }

    public void setAllowed(boolean allowed) {
        this.allowed = allowed;
    }

    public String getProtectedRef() {
        return protectedRef;
    }

    @Override
    public String toString() {
        return "WriteGateState{allowed=" + allowed + ", protectedRef=" + Objects.toString(protectedRef) + "}";
    }
}
