package com.tool.invocation.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Authorization policy evaluated for every mutating call.
 *
 * <p>Under {@link WriteGatePolicy#PROTECTED_REF}:</p>
 * <ul>
 *   <li>no target ref: denied unless writes are allowed</li>
 *   <li>any target ref equal to the protected ref (after stripping {@code refs/heads/}): denied unless writes
 *   are allowed</li>
 *   <li>only other target refs: permitted</li>
 * </ul>
 */
public class WriteGate {

    private static final Logger log = LoggerFactory.getLogger(WriteGate.class);

    private static final String HEADS_PREFIX = "refs/heads/";

    private final WriteGateState state;
    private final WriteGatePolicy policy;

    public WriteGate(WriteGateState state, WriteGatePolicy policy) {
        this.state = Objects.requireNonNull(state, "state is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    public WriteGateDecision evaluate(String targetRef) {
        return evaluateAll(targetRef != null ? List.of(targetRef) : List.of());
    }

    /**
     * Evaluates a call that names several refs. The call counts as touching the protected ref when
     * any of them is the protected ref.
     */
    public WriteGateDecision evaluateAll(Collection<String> targetRefs) {
        List<String> refs = normalizeAll(targetRefs);
        String primary = refs.isEmpty() ? null : refs.get(0);
        if (policy == WriteGatePolicy.ALLOW_ALL) {
            return WriteGateDecision.permit(primary, WriteGateDecision.POLICY_ALLOW_ALL);
        }
        String protectedRef = state.getProtectedRef();
        boolean touchesProtected = refs.contains(protectedRef);
        if (primary != null && !touchesProtected) {
            return WriteGateDecision.permit(primary, WriteGateDecision.UNPROTECTED_REF);
        }
        String ref = touchesProtected ? protectedRef : null;
        if (state.isAllowed()) {
            return WriteGateDecision.permit(ref, WriteGateDecision.AUTHORIZED);
        }
        return WriteGateDecision.deny(ref, ref == null ? WriteGateDecision.UNKNOWN_TARGET : WriteGateDecision.PROTECTED_REF);
    }

    /**
     * Evaluates the gate and throws if the call is denied.
     *
     * @throws WriteNotAuthorizedException if the call may not proceed
     */
    public WriteGateDecision check(String toolName, String targetRef) {
        return checkAll(toolName, targetRef != null ? List.of(targetRef) : List.of());
    }

    /**
     * Evaluates the gate for every ref a call names and throws if the call is denied.
     *
     * @throws WriteNotAuthorizedException if the call may not proceed
     */
    public WriteGateDecision checkAll(String toolName, Collection<String> targetRefs) {
        WriteGateDecision decision = evaluateAll(targetRefs);
        if (!decision.permitted()) {
            log.debug("write.denied tool={} targetRefs={} reason={}", toolName, targetRefs, decision.reason());
            throw new WriteNotAuthorizedException(toolName, decision, state.getProtectedRef());
        }
        return decision;
    }

    /**
     * Flips the authorization toggle. Idempotent.
     */
    public void authorize(boolean allowed) {
        boolean previous = state.isAllowed();
        state.setAllowed(allowed);
        if (previous != allowed) {
            log.info("write.gate.changed allowed={} protectedRef={}", allowed, state.getProtectedRef());
        }
    }

    public WriteGateState state() {
        return state;
    }

    public WriteGatePolicy policy() {
        return policy;
    }

    /**
     * Strips a {@code refs/heads/} prefix and surrounding whitespace.
     */
    public static String normalizeRef(String ref) {
        String trimmed = ref.trim();
        return trimmed.startsWith(HEADS_PREFIX) ? trimmed.substring(HEADS_PREFIX.length()) : trimmed;
    }

    private static List<String> normalizeAll(Collection<String> refs) {
        List<String> out = new ArrayList<>();
        if (refs != null) {
            for (String ref : refs) {
                if (ref != null && !ref.isBlank()) {
                    out.add(normalizeRef(ref));
                }
            }
        }
        return out;
    }
}
