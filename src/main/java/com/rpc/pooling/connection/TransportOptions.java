package com.rpc.pooling.connection;

import java.time.Duration;
import java.util.List;

/**
 * Transport-level options applied to every connection of a pool.
 *
 * @param keepaliveTime         interval between keepalive pings
 * @param keepaliveTimeout      time to wait for a keepalive acknowledgement
 * @param maxConnectionIdle     idle time after which the transport may drop the connection
 * @param maxConnectionAge      maximum lifetime of a connection
 * @param maxConnectionAgeGrace grace period granted to in-flight calls at max age
 * @param maxMessageSize        maximum inbound and outbound message size in bytes
 * @param extraOptions          transport-specific options passed through unmodified
 */
public record TransportOptions(
        Duration keepaliveTime,
        Duration keepaliveTimeout,
        Duration maxConnectionIdle,
        Duration maxConnectionAge,
        Duration maxConnectionAgeGrace,
        int maxMessageSize,
        List<Object> extraOptions
) {

    public TransportOptions {
        extraOptions = extraOptions != null ? List.copyOf(extraOptions) : List.of();
    }
}
