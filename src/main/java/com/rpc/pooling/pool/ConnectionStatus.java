package com.rpc.pooling.pool;

import com.rpc.pooling.connection.ConnectivityState;

/**
 * State of one pool slot at the time a {@link PoolStats} snapshot was taken.
 *
 * @param index slot index in {@code [0, poolSize)}
 * @param state connectivity state of the connection held in the slot
 */
public record ConnectionStatus(int index, ConnectivityState state) {
}
