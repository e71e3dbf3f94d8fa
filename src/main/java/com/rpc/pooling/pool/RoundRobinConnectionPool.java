package com.rpc.pooling.pool;

import com.rpc.pooling.connection.Connection;
import com.rpc.pooling.connection.ConnectionException;
import com.rpc.pooling.connection.ConnectionFactory;
import com.rpc.pooling.connection.ConnectivityState;
import com.rpc.pooling.connection.TransportOptions;
import com.rpc.pooling.logging.LogContext;
import com.rpc.pooling.metrics.NoOpPoolMetrics;
import com.rpc.pooling.metrics.PoolMetrics;
import com.rpc.pooling.scheduling.ExecutorTaskScheduler;
import com.rpc.pooling.scheduling.ScheduledTask;
import com.rpc.pooling.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link ConnectionPool} holding exactly {@code poolSize} connections to one target,
 * selected round robin and repaired in the background.
 *
 * <p>The slot array and the cursor are guarded by one {@link ReentrantReadWriteLock}.
 * Dialing and waiting on connection state happen outside the lock; the lock is held only
 * to read a snapshot, advance the cursor or swap repaired slots.</p>
 *
 * <p>Construction is all-or-nothing: if any dial fails, the connections created so far
 * are closed and the failure is rethrown.</p>
 */
public class RoundRobinConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(RoundRobinConnectionPool.class);

    private final String target;
    private final int poolSize;
    private final TransportOptions transportOptions;
    private final ConnectionFactory connectionFactory;
    private final PoolMetrics metrics;
    private final Connection[] connections;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock repairLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ScheduledTask repairTask;
    private final ExecutorTaskScheduler ownedScheduler;
    private int cursor;

    /**
     * Creates a pool with a private repair thread and no metrics.
     */
    public RoundRobinConnectionPool(PoolConfig config, ConnectionFactory connectionFactory) {
        this(config, connectionFactory, null, new NoOpPoolMetrics());
    }

    /**
     * Creates a pool and dials all of its connections.
     *
     * @param config            pool configuration
     * @param connectionFactory dials connections to {@code config.getTarget()}
     * @param scheduler         runs the repair pass; if null, the pool owns a single daemon thread
     * @param metrics           receives repair and selection events
     * @throws ConnectionException if any connection cannot be created
     */
    public RoundRobinConnectionPool(PoolConfig config, ConnectionFactory connectionFactory,
                                    TaskScheduler scheduler, PoolMetrics metrics) {
        this.target = config.getTarget();
        this.poolSize = config.getPoolSize() > 0 ? config.getPoolSize() : PoolConfig.DEFAULT_POOL_SIZE;
        this.transportOptions = config.toTransportOptions();
        this.connectionFactory = connectionFactory;
        this.metrics = metrics != null ? metrics : new NoOpPoolMetrics();
        this.connections = dialAll();

        if (scheduler == null) {
            this.ownedScheduler = new ExecutorTaskScheduler("rpc-pool-repair-" + target);
            scheduler = ownedScheduler;
        } else {
            this.ownedScheduler = null;
        }
        try {
            this.repairTask = scheduler.scheduleRepeating(
                    "repair[" + target + "]", this::repair, config.getRepairInterval());
        } catch (RuntimeException e) {
            for (Connection connection : connections) {
                closeQuietly(connection);
            }
            if (ownedScheduler != null) {
                ownedScheduler.close();
            }
            throw new ConnectionException("Failed to schedule repair task for " + target, e);
        }

        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public Connection get() {
        ensureOpen();
        lock.writeLock().lock();
        try {
            Connection connection = connections[cursor];
            cursor = (cursor + 1) % poolSize;
            return connection;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Connection getHealthy(Duration timeout) {
        ensureOpen();
        long startNanos = System.nanoTime();
        long deadline = startNanos + timeout.toNanos();

        Connection[] ordered;
        lock.readLock().lock();
        try {
            ordered = new Connection[poolSize];
            for (int i = 0; i < poolSize; i++) {
                ordered[i] = connections[(cursor + i) % poolSize];
            }
        } finally {
            lock.readLock().unlock();
        }

        for (Connection connection : ordered) {
            if (connection.getState().isHealthy()) {
                metrics.recordHealthyWait(target, Duration.ofNanos(System.nanoTime() - startNanos));
                return connection;
            }
        }

        // Nothing usable right now: give each failing connection a chance to recover.
        try {
            for (Connection connection : ordered) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                if (connection.awaitStateChange(ConnectivityState.TRANSIENT_FAILURE, Duration.ofNanos(remaining))
                        && connection.getState().isHealthy()) {
                    metrics.recordHealthyWait(target, Duration.ofNanos(System.nanoTime() - startNanos));
                    return connection;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.recordNoHealthyConnection(target);
            throw new NoHealthyConnectionException(target,
                    "Interrupted while waiting for a healthy connection to " + target, e);
        }

        metrics.recordNoHealthyConnection(target);
        log.debug("No healthy connection to {} within {}", target, timeout);
        throw new NoHealthyConnectionException(target, "No healthy connection available to " + target);
    }

    @Override
    public List<Connection> getAll() {
        ensureOpen();
        lock.readLock().lock();
        try {
            return List.of(connections);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        return poolSize;
    }

    @Override
    public String target() {
        return target;
    }

    @Override
    public PoolStats getStats() {
        lock.readLock().lock();
        try {
            List<ConnectivityState> states = new ArrayList<>(poolSize);
            for (Connection connection : connections) {
                states.add(connection.getState());
            }
            return PoolStats.of(target, states);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Runs one repair pass: every slot in TRANSIENT_FAILURE or SHUTDOWN is redialed, and
     * the successful replacements are swapped in together. A failed dial leaves the slot
     * untouched until the next pass. Never throws.
     */
    void repair() {
        if (closed.get() || !repairLock.tryLock()) {
            return;
        }
        try {
            if (closed.get()) {
                return;
            }
            Connection[] snapshot;
            lock.readLock().lock();
            try {
                snapshot = Arrays.copyOf(connections, poolSize);
            } finally {
                lock.readLock().unlock();
            }

            Connection[] replacements = new Connection[poolSize];
            int replaced = 0;
            for (int i = 0; i < poolSize; i++) {
                ConnectivityState state = snapshot[i].getState();
                if (!state.isBroken()) {
                    continue;
                }
                try (LogContext ctx = LogContext.forRepair(target, i)) {
                    log.info("Connection {} to {} is unhealthy (state: {}), attempting to reconnect", i, target, state);
                    metrics.recordRepairAttempt(target);
                    try {
                        Connection replacement = connectionFactory.connect(target, transportOptions);
                        if (replacement == null) {
                            metrics.recordRepairFailure(target);
                            log.warn("Connection factory returned null while recreating connection {} to {}", i, target);
                            continue;
                        }
                        replacements[i] = replacement;
                        replaced++;
                    } catch (RuntimeException e) {
                        metrics.recordRepairFailure(target);
                        log.warn("Failed to recreate connection {} to {}: {}", i, target, e.getMessage());
                    }
                }
            }
            if (replaced == 0) {
                return;
            }

            List<Connection> retired = new ArrayList<>(replaced);
            lock.writeLock().lock();
            try {
                for (int i = 0; i < poolSize; i++) {
                    Connection replacement = replacements[i];
                    if (replacement == null) {
                        continue;
                    }
                    if (closed.get() || connections[i] != snapshot[i]) {
                        retired.add(replacement);
                    } else {
                        retired.add(connections[i]);
                        connections[i] = replacement;
                        metrics.recordRepairSuccess(target);
                        log.info("Successfully recreated connection {} to {}", i, target);
                    }
                }
            } finally {
                lock.writeLock().unlock();
            }
            retired.forEach(this::closeQuietly);
        } finally {
            repairLock.unlock();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing connection pool to {}...", target);
        repairTask.cancel();
        if (ownedScheduler != null) {
            ownedScheduler.close();
        }
        // Wait for a repair pass that is still running; it sees the closed flag before swapping.
        repairLock.lock();
        repairLock.unlock();

        List<RuntimeException> failures = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (int i = 0; i < poolSize; i++) {
                try {
                    connections[i].close();
                } catch (RuntimeException e) {
                    failures.add(new ConnectionException(
                            "Failed to close connection " + i + " to " + target, e));
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (!failures.isEmpty()) {
            throw new PoolCloseException("Errors closing connections to " + target, failures);
        }
        log.info("Connection pool to {} closed", target);
    }

    private Connection[] dialAll() {
        Connection[] created = new Connection[poolSize];
        for (int i = 0; i < poolSize; i++) {
            try {
                created[i] = connectionFactory.connect(target, transportOptions);
            } catch (RuntimeException e) {
                for (int j = 0; j < i; j++) {
                    closeQuietly(created[j]);
                }
                throw new ConnectionException("Failed to create connection " + i + " to " + target, e);
            }
            if (created[i] == null) {
                for (int j = 0; j < i; j++) {
                    closeQuietly(created[j]);
                }
                throw new ConnectionException("Connection factory returned null for connection " + i + " to " + target);
            }
        }
        return created;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection to {}: {}", target, e.getMessage());
        }
    }
}
