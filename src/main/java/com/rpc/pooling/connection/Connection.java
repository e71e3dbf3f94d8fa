package com.rpc.pooling.connection;

import java.time.Duration;

/**
 * An opaque client connection to one remote target.
 * The pool only observes its connectivity state and closes it; building typed
 * RPC clients on top of it is left to the caller.
 */
public interface Connection extends AutoCloseable {

    /**
     * Returns the address this connection was dialed to.
     */
    String target();

    /**
     * Returns the current connectivity state without triggering a connection attempt.
     */
    ConnectivityState getState();

    /**
     * Waits until the state of this connection differs from {@code source}.
     * Returns immediately if the state already differs.
     *
     * @param source  the state to wait away from
     * @param timeout maximum time to wait
     * @return true if the state changed before the timeout expired
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean awaitStateChange(ConnectivityState source, Duration timeout) throws InterruptedException;

    /**
     * Closes this connection.
     *
     * @throws ConnectionException if the connection could not be closed cleanly
     */
    @Override
    void close();
}
