package com.rpc.pooling.connection;

/**
 * Connectivity state of a pooled {@link Connection}.
 */
public enum ConnectivityState {
    CONNECTING,
    READY,
    IDLE,
    TRANSIENT_FAILURE,
    SHUTDOWN;

    /**
     * Returns true if a connection in this state can serve calls right away.
     * An IDLE connection reconnects on its first call, so it counts as healthy.
     */
    public boolean isHealthy() {
        return this == READY || this == IDLE;
    }

    /**
     * Returns true if a connection in this state must be replaced by the repair task.
     */
    public boolean isBroken() {
        return this == TRANSIENT_FAILURE || this == SHUTDOWN;
    }
}
