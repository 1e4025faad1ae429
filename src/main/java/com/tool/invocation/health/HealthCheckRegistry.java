package com.tool.invocation.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the registered checks and combines them: the worst individual status wins.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        HealthStatus overall = HealthStatus.up("OK");
        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            components.put(check.getName(), result.toMap());
            if (result.isWorseThan(overall)) {
                overall = new HealthStatus(result.status(), check.getName() + ": " + result.message(), Map.of());
            }
        }
        return overall.withDetail("checks", components);
    }

    public List<String> names() {
        List<String> names = new ArrayList<>();
        checks.forEach(c -> names.add(c.getName()));
        return names;
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
