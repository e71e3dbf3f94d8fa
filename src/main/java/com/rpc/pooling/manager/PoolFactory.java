package com.rpc.pooling.manager;

import com.rpc.pooling.pool.ConnectionPool;
import com.rpc.pooling.pool.PoolConfig;

/**
 * Creates the {@link ConnectionPool} registered under a service name.
 */
@FunctionalInterface
public interface PoolFactory {

    /**
     * @throws com.rpc.pooling.connection.ConnectionException if the pool cannot be constructed
     */
    ConnectionPool create(String serviceName, PoolConfig config);
}
