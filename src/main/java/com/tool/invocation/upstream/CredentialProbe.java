package com.tool.invocation.upstream;

import java.util.List;
import java.util.Map;

/**
 * Tells whether a usable credential for the remote code-hosting API is present.
 * This is the only coupling between the invocation core and authentication.
 */
@FunctionalInterface
public interface CredentialProbe {

    boolean hasCredential();

    static CredentialProbe constant(boolean present) {
        return () -> present;
    }

    /**
     * Present when any of the given environment variables is set to a non-blank value.
     */
    static CredentialProbe fromEnvironment(String... variableNames) {
        return fromMap(System.getenv(), variableNames);
    }

    static CredentialProbe fromMap(Map<String, String> environment, String... variableNames) {
        List<String> names = List.of(variableNames);
        return () -> names.stream()
                .map(environment::get)
                .anyMatch(value -> value != null && !value.isBlank());
    }
}
