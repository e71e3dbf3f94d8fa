package com.rpc.pooling.metrics;

import com.rpc.pooling.pool.ConnectionPool;

import java.time.Duration;

/**
 * No-op implementation of {@link PoolMetrics}.
 */
public class NoOpPoolMetrics implements PoolMetrics {

    @Override
    public void registerPool(String serviceName, ConnectionPool pool) {
    }

    @Override
    public void recordRepairAttempt(String target) {
    }

    @Override
    public void recordRepairSuccess(String target) {
    }

    @Override
    public void recordRepairFailure(String target) {
    }

    @Override
    public void recordHealthyWait(String target, Duration waited) {
    }

    @Override
    public void recordNoHealthyConnection(String target) {
    }
}
