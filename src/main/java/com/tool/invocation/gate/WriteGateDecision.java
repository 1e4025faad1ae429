package com.tool.invocation.gate;

/**
 * Result of evaluating the write gate for one call.
 *
 * @param permitted  whether the call may proceed
 * @param targetRef  normalized target ref, null when none could be extracted
 * @param reason     short machine-readable reason
 */
public record WriteGateDecision(boolean permitted, String targetRef, String reason) {

    public static final String AUTHORIZED = "authorized";
    public static final String UNPROTECTED_REF = "unprotected_ref";
    public static final String POLICY_ALLOW_ALL = "policy_allow_all";
    public static final String PROTECTED_REF = "protected_ref";
    public static final String UNKNOWN_TARGET = "unknown_target";

    static WriteGateDecision permit(String targetRef, String reason) {
        return new WriteGateDecision(true, targetRef, reason);
    }

    static WriteGateDecision deny(String targetRef, String reason) {
        return new WriteGateDecision(false, targetRef, reason);
    }
}
