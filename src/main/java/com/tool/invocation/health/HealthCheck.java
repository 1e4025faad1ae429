package com.tool.invocation.health;

/**
 * A single component check reported by {@code get_server_status}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
