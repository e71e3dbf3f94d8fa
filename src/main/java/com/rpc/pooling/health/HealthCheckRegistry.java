package com.rpc.pooling.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry of health checks combined into one readiness status.
 *
 * <p>The aggregate takes the worst status of all checks (DOWN over DEGRADED over UP)
 * and keeps each check's result under its name. A check that throws counts as DOWN.</p>
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    /**
     * Removes every check registered under {@code name}.
     */
    public void unregister(String name) {
        checks.removeIf(check -> check.getName().equals(name));
    }

    /**
     * Runs all registered checks and returns the aggregate status.
     */
    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            results.put(check.getName(), run(check));
        }
        return HealthStatus.aggregate(results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check failed: " + e.getMessage());
        }
    }
}
