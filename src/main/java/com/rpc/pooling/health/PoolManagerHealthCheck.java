package com.rpc.pooling.health;

import com.rpc.pooling.manager.ConnectionPoolManager;
import com.rpc.pooling.pool.PoolStats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check over every pool registered in a {@link ConnectionPoolManager}.
 * Reports the worst per-pool status, with each service's result kept under its name.
 * Pools created after this check is registered are picked up on the next run.
 */
public class PoolManagerHealthCheck implements HealthCheck {

    private final ConnectionPoolManager manager;

    public PoolManagerHealthCheck(ConnectionPoolManager manager) {
        this.manager = manager;
    }

    @Override
    public String getName() {
        return "connectionPools";
    }

    @Override
    public HealthStatus check() {
        Map<String, PoolStats> allStats;
        try {
            allStats = manager.getAllStats();
        } catch (Exception e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
        if (allStats.isEmpty()) {
            return HealthStatus.up("No connection pools registered");
        }

        Map<String, HealthStatus> perService = new LinkedHashMap<>();
        allStats.forEach((service, stats) -> perService.put(service, HealthStatus.of(stats)));
        return HealthStatus.aggregate(perService);
    }
}
