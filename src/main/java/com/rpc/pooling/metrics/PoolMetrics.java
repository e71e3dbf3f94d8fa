package com.rpc.pooling.metrics;

import com.rpc.pooling.pool.ConnectionPool;

import java.time.Duration;

/**
 * Interface for recording connection pool metrics.
 * The default {@link NoOpPoolMetrics} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface PoolMetrics {

    /**
     * Registers gauges that sample {@code pool} for the given logical service name.
     */
    void registerPool(String serviceName, ConnectionPool pool);

    void recordRepairAttempt(String target);

    void recordRepairSuccess(String target);

    void recordRepairFailure(String target);

    void recordHealthyWait(String target, Duration waited);

    void recordNoHealthyConnection(String target);
}
