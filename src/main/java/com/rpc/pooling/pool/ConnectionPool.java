package com.rpc.pooling.pool;

import com.rpc.pooling.connection.Connection;

import java.time.Duration;
import java.util.List;

/**
 * Fixed-size set of long-lived connections to one remote target.
 * Connections are handed out without borrow/release: callers use the returned handle
 * directly and must not close it.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Returns the next connection in round-robin order, regardless of its state.
     *
     * @throws IllegalStateException if the pool is closed
     */
    Connection get();

    /**
     * Returns a connection that is READY or IDLE, waiting at most {@code timeout}
     * for a failing connection to recover. Does not advance the round-robin cursor.
     *
     * @param timeout maximum time to wait
     * @return a healthy connection
     * @throws NoHealthyConnectionException if none became healthy in time or the thread was interrupted
     * @throws IllegalStateException        if the pool is closed
     */
    Connection getHealthy(Duration timeout);

    /**
     * Returns a snapshot of all connections, ordered by slot index.
     */
    List<Connection> getAll();

    /**
     * Returns the number of slots in the pool.
     */
    int size();

    /**
     * Returns the remote address the pool connects to.
     */
    String target();

    /**
     * Returns a consistent snapshot of per-slot connectivity.
     */
    PoolStats getStats();

    /**
     * Stops background repair and closes every connection. Closing twice is a no-op.
     *
     * @throws PoolCloseException if one or more connections failed to close
     */
    @Override
    void close();
}
