package com.tool.invocation.health;

import com.tool.invocation.upstream.CredentialProbe;

/**
 * DEGRADED when no credential for the remote API is present: read-only local tools still work,
 * remote tools will fail upstream.
 */
public class CredentialHealthCheck implements HealthCheck {

    private final CredentialProbe probe;

    public CredentialHealthCheck(CredentialProbe probe) {
        this.probe = probe;
    }

    @Override
    public String getName() {
        return "credentials";
    }

    @Override
    public HealthStatus check() {
        boolean present = probe.hasCredential();
        HealthStatus base = present
                ? HealthStatus.up("Credential present")
                : HealthStatus.degraded("No credential configured for the remote API");
        return base.withDetail("credential_present", present);
    }
}
