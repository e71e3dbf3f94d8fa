package com.rpc.pooling.manager;

import com.rpc.pooling.connection.ConnectionFactory;
import com.rpc.pooling.logging.LogContext;
import com.rpc.pooling.metrics.NoOpPoolMetrics;
import com.rpc.pooling.metrics.PoolMetrics;
import com.rpc.pooling.pool.ConnectionPool;
import com.rpc.pooling.pool.PoolCloseException;
import com.rpc.pooling.pool.PoolConfig;
import com.rpc.pooling.pool.PoolStats;
import com.rpc.pooling.pool.RoundRobinConnectionPool;
import com.rpc.pooling.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of {@link ConnectionPool}s keyed by logical service name, e.g. {@code order-service}.
 *
 * <p>At most one pool exists per name. Pools are created lazily by {@link #getOrCreate}
 * or in bulk by {@link #createCommonPools}. The manager is a plain object: create one per
 * application (or per test) and pass it to the clients that need it.</p>
 */
public class ConnectionPoolManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);

    private final Map<String, ConnectionPool> pools = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final PoolFactory poolFactory;
    private final PoolMetrics metrics;
    private boolean closed;

    /**
     * Creates a manager whose pools dial through {@code connectionFactory} and share
     * {@code scheduler} for their repair passes.
     */
    public ConnectionPoolManager(ConnectionFactory connectionFactory, TaskScheduler scheduler, PoolMetrics metrics) {
        this((name, config) -> new RoundRobinConnectionPool(config, connectionFactory, scheduler, metrics), metrics);
    }

    public ConnectionPoolManager(PoolFactory poolFactory) {
        this(poolFactory, new NoOpPoolMetrics());
    }

    public ConnectionPoolManager(PoolFactory poolFactory, PoolMetrics metrics) {
        this.poolFactory = poolFactory;
        this.metrics = metrics != null ? metrics : new NoOpPoolMetrics();
    }

    /**
     * Returns the pool registered under {@code name}, creating it from {@code config} if absent.
     * Concurrent callers for the same unseen name get the same instance; the pool is built once.
     *
     * @throws PoolCreationException if the pool cannot be constructed
     * @throws IllegalStateException if the manager is closed
     */
    public ConnectionPool getOrCreate(String name, PoolConfig config) {
        lock.readLock().lock();
        try {
            ConnectionPool existing = pools.get(name);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Connection pool manager is closed");
            }
            ConnectionPool existing = pools.get(name);
            if (existing != null) {
                return existing;
            }

            ConnectionPool pool;
            try (LogContext ctx = LogContext.forPool(name, config.getTarget())) {
                try {
                    pool = poolFactory.create(name, config);
                } catch (RuntimeException e) {
                    log.error("Failed to create pool for {} ({}): {}", name, config.getTarget(), e.getMessage());
                    throw new PoolCreationException(name, e);
                }
                pools.put(name, pool);
                metrics.registerPool(name, pool);
                log.info("Registered pool for {} -> {} ({} connections)", name, pool.target(), pool.size());
            }
            return pool;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the pool registered under {@code name}, without creating one.
     */
    public Optional<ConnectionPool> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(pools.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Creates a pool for every service with a non-blank target, in iteration order.
     * Stops at the first failure; pools created before it stay registered.
     *
     * @param serviceTargets  service name to target address
     * @param defaultPoolSize connections per pool; {@code <= 0} means the default
     * @throws PoolCreationException for the first service whose pool cannot be constructed
     */
    public void createCommonPools(Map<String, String> serviceTargets, int defaultPoolSize) {
        ServicePoolConfig.Builder builder = ServicePoolConfig.builder().defaultPoolSize(defaultPoolSize);
        serviceTargets.forEach(builder::service);
        createCommonPools(builder.build());
    }

    /**
     * Creates a pool for every configured service of {@code config}, with its
     * per-service transport options. Same failure rules as {@link #createCommonPools(Map, int)}.
     */
    public void createCommonPools(ServicePoolConfig config) {
        for (Map.Entry<String, ServicePoolConfig.ServiceTarget> entry : config.getServices().entrySet()) {
            ServicePoolConfig.ServiceTarget service = entry.getValue();
            if (!service.isConfigured()) {
                log.debug("Skipping {}: no target configured", entry.getKey());
                continue;
            }
            getOrCreate(entry.getKey(), config.poolConfigFor(service));
        }
    }

    /**
     * Returns a statistics snapshot for every registered pool, keyed by service name.
     */
    public Map<String, PoolStats> getAllStats() {
        lock.readLock().lock();
        try {
            Map<String, PoolStats> stats = new LinkedHashMap<>();
            pools.forEach((name, pool) -> stats.put(name, pool.getStats()));
            return Collections.unmodifiableMap(stats);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the names of all registered pools, in registration order.
     */
    public Set<String> list() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(pools.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes every registered pool and empties the registry. A failure closing one pool
     * does not stop the others from being closed. Closing twice is a no-op.
     *
     * @throws PoolCloseException if one or more pools failed to close
     */
    @Override
    public void close() {
        List<RuntimeException> failures = new ArrayList<>();
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            log.info("Closing {} connection pool(s)...", pools.size());
            for (Map.Entry<String, ConnectionPool> entry : pools.entrySet()) {
                try {
                    entry.getValue().close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close pool {}: {}", entry.getKey(), e.getMessage());
                    failures.add(new PoolCloseException("Failed to close pool " + entry.getKey(), List.of(e)));
                }
            }
            pools.clear();
        } finally {
            lock.writeLock().unlock();
        }

        if (!failures.isEmpty()) {
            throw new PoolCloseException("Errors closing pools", failures);
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }
}
