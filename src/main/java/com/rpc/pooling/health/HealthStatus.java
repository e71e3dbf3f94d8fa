package com.rpc.pooling.health;

import com.rpc.pooling.pool.PoolStats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness of one connection pool, or of a set of pools keyed by service name.
 *
 * <p>A pool is DOWN when no connection is READY or IDLE and DEGRADED when fewer than
 * {@value #DEGRADED_THRESHOLD}% are. A set of pools takes the worst status of its members.</p>
 *
 * @param status   readiness of this pool or set of pools
 * @param message  reason for a status other than UP
 * @param pool     statistics the status was computed from; null for aggregates and failed checks
 * @param services per-service results of an aggregate, in registration order; empty otherwise
 */
public record HealthStatus(Status status, String message, PoolStats pool, Map<String, HealthStatus> services) {

    public static final double DEGRADED_THRESHOLD = 50.0;

    /**
     * Ordered from best to worst.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        services = services != null ? Collections.unmodifiableMap(new LinkedHashMap<>(services)) : Map.of();
    }

    /**
     * Computes the readiness of a single pool from its statistics.
     */
    public static HealthStatus of(PoolStats stats) {
        double healthy = stats.healthyPercentage();
        if (!stats.isHealthy()) {
            return new HealthStatus(Status.DOWN, "No healthy connection to " + stats.target(), stats, null);
        }
        if (healthy < DEGRADED_THRESHOLD) {
            return new HealthStatus(Status.DEGRADED,
                    String.format("Healthy connections low: %.0f%%", healthy), stats, null);
        }
        return new HealthStatus(Status.UP, "OK", stats, null);
    }

    /**
     * Combines per-service results into one status: the worst member wins and its
     * message is prefixed with the service name. An empty set is UP.
     */
    public static HealthStatus aggregate(Map<String, HealthStatus> services) {
        Status worst = Status.UP;
        String message = "OK";
        for (Map.Entry<String, HealthStatus> entry : services.entrySet()) {
            HealthStatus result = entry.getValue();
            if (result.status().ordinal() > worst.ordinal()) {
                worst = result.status();
                message = entry.getKey() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, message, null, services);
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null, null);
    }

    /**
     * A check that could not read its pool.
     */
    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null, null);
    }

    /**
     * HTTP status a readiness endpoint should answer with: 503 when DOWN or DEGRADED.
     */
    public int httpStatusCode() {
        return status == Status.UP ? 200 : 503;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    /**
     * Share of usable connections, 0 when no statistics were available.
     */
    public double healthyPercentage() {
        return pool != null ? pool.healthyPercentage() : 0.0;
    }

    /**
     * Renders the status as a JSON-ready map for a readiness endpoint: per-pool counts,
     * and for an aggregate the per-service entries plus a connection summary.
     */
    public Map<String, Object> toResponseBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.name());
        body.put("message", message);
        if (pool != null) {
            body.put("target", pool.target());
            body.put("healthyPercentage", Math.round(pool.healthyPercentage() * 10.0) / 10.0);
            body.put("readyConnections", pool.readyCount());
            body.put("idleConnections", pool.idleCount());
            body.put("connectingConnections", pool.connectingCount());
            body.put("failedConnections", pool.transientFailureCount());
            body.put("shutdownConnections", pool.shutdownCount());
            body.put("totalConnections", pool.poolSize());
        }
        if (!services.isEmpty()) {
            Map<String, Object> perService = new LinkedHashMap<>();
            int[] byStatus = new int[Status.values().length];
            int total = 0;
            int ready = 0;
            int failed = 0;
            for (Map.Entry<String, HealthStatus> entry : services.entrySet()) {
                HealthStatus result = entry.getValue();
                perService.put(entry.getKey(), result.toResponseBody());
                byStatus[result.status().ordinal()]++;
                if (result.pool() != null) {
                    total += result.pool().poolSize();
                    ready += result.pool().readyCount();
                    failed += result.pool().transientFailureCount();
                }
            }
            body.put("services", perService);

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("totalServices", services.size());
            summary.put("upServices", byStatus[Status.UP.ordinal()]);
            summary.put("degradedServices", byStatus[Status.DEGRADED.ordinal()]);
            summary.put("downServices", byStatus[Status.DOWN.ordinal()]);
            summary.put("totalConnections", total);
            summary.put("readyConnections", ready);
            summary.put("failedConnections", failed);
            body.put("summary", summary);
        }
        return body;
    }
}
