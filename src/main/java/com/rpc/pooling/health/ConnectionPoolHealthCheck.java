package com.rpc.pooling.health;

import com.rpc.pooling.pool.ConnectionPool;

/**
 * Health check for one connection pool.
 * DOWN when no connection is READY or IDLE, DEGRADED when fewer than half are.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private final String name;
    private final ConnectionPool pool;

    public ConnectionPoolHealthCheck(String name, ConnectionPool pool) {
        this.name = name;
        this.pool = pool;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public HealthStatus check() {
        try {
            return HealthStatus.of(pool.getStats());
        } catch (Exception e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
