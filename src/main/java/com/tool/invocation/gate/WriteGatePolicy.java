package com.tool.invocation.gate;

/**
 * How mutating calls are gated.
 */
public enum WriteGatePolicy {

    /**
     * Calls targeting the protected ref, or with no identifiable target, need explicit authorization.
     * Calls targeting any other ref are always permitted.
     */
    PROTECTED_REF,

    /**
     * Every mutating call is permitted regardless of the authorization toggle.
     */
    ALLOW_ALL
}
