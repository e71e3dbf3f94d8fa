package com.rpc.pooling.pool;

import com.rpc.pooling.connection.ConnectivityState;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time statistics for a {@link ConnectionPool}.
 *
 * @param target                 remote address of the pool
 * @param poolSize               number of slots in the pool
 * @param readyCount             connections in READY
 * @param idleCount              connections in IDLE
 * @param connectingCount        connections in CONNECTING
 * @param transientFailureCount  connections in TRANSIENT_FAILURE
 * @param shutdownCount          connections in SHUTDOWN
 * @param connections            per-slot states, ordered by index
 */
public record PoolStats(
        String target,
        int poolSize,
        int readyCount,
        int idleCount,
        int connectingCount,
        int transientFailureCount,
        int shutdownCount,
        List<ConnectionStatus> connections
) {

    public PoolStats {
        connections = connections != null ? List.copyOf(connections) : List.of();
    }

    /**
     * Builds statistics from the slot states of a pool, in slot order.
     */
    public static PoolStats of(String target, List<ConnectivityState> states) {
        int ready = 0;
        int idle = 0;
        int connecting = 0;
        int failure = 0;
        int shutdown = 0;
        List<ConnectionStatus> connections = new ArrayList<>(states.size());
        for (int i = 0; i < states.size(); i++) {
            ConnectivityState state = states.get(i);
            connections.add(new ConnectionStatus(i, state));
            switch (state) {
                case READY -> ready++;
                case IDLE -> idle++;
                case CONNECTING -> connecting++;
                case TRANSIENT_FAILURE -> failure++;
                case SHUTDOWN -> shutdown++;
            }
        }
        return new PoolStats(target, states.size(), ready, idle, connecting, failure, shutdown, connections);
    }

    /**
     * Returns true if at least one connection is READY or IDLE.
     */
    public boolean isHealthy() {
        return readyCount > 0 || idleCount > 0;
    }

    /**
     * Returns the share of READY and IDLE connections, from 0 to 100.
     */
    public double healthyPercentage() {
        if (poolSize == 0) {
            return 0.0;
        }
        return (double) (readyCount + idleCount) / poolSize * 100;
    }

    public int healthyCount() {
        return readyCount + idleCount;
    }
}
