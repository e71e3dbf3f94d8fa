package com.rpc.pooling.connection;

/**
 * Dials new {@link Connection}s. Implementations bind the pool to a concrete RPC transport.
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Establishes a new connection to {@code target}.
     *
     * @param target  the remote address, e.g. {@code order-service:50053}
     * @param options transport options shared by every connection of one pool
     * @return a new connection
     * @throws ConnectionException if the connection cannot be created
     */
    Connection connect(String target, TransportOptions options);
}
