package com.rpc.pooling.health;

/**
 * A single readiness check, e.g. the connectivity of one downstream service pool.
 */
public interface HealthCheck {

    /**
     * Returns the name under which this check reports, e.g. {@code order-service}.
     */
    String getName();

    /**
     * Runs the check. Implementations report failures as a DOWN status instead of throwing.
     */
    HealthStatus check();
}
