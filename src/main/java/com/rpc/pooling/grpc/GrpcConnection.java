package com.rpc.pooling.grpc;

import com.rpc.pooling.connection.Connection;
import com.rpc.pooling.connection.ConnectionException;
import com.rpc.pooling.connection.ConnectivityState;
import io.grpc.Channel;
import io.grpc.ManagedChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link Connection} backed by a gRPC {@link ManagedChannel}.
 */
public class GrpcConnection implements Connection {
    private static final Logger log = LoggerFactory.getLogger(GrpcConnection.class);

    private final String target;
    private final ManagedChannel channel;
    private final Duration closeTimeout;

    public GrpcConnection(String target, ManagedChannel channel, Duration closeTimeout) {
        this.target = target;
        this.channel = channel;
        this.closeTimeout = closeTimeout;
    }

    /**
     * Returns the channel to build generated stubs on.
     */
    public Channel channel() {
        return channel;
    }

    @Override
    public String target() {
        return target;
    }

    @Override
    public ConnectivityState getState() {
        return fromGrpc(channel.getState(false));
    }

    @Override
    public boolean awaitStateChange(ConnectivityState source, Duration timeout) throws InterruptedException {
        io.grpc.ConnectivityState current = channel.getState(false);
        if (fromGrpc(current) != source) {
            return true;
        }
        CountDownLatch changed = new CountDownLatch(1);
        channel.notifyWhenStateChanged(current, changed::countDown);
        return changed.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Shuts the channel down, waiting up to the close timeout for in-flight calls
     * before forcing it.
     */
    @Override
    public void close() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("Channel to {} did not terminate within {}, forcing shutdown", target, closeTimeout);
                channel.shutdownNow();
            }
        } catch (InterruptedException e) {
            channel.shutdownNow();
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while closing channel to " + target, e);
        }
    }

    @Override
    public String toString() {
        return "GrpcConnection{target='" + target + "', state=" + getState() + '}';
    }

    static ConnectivityState fromGrpc(io.grpc.ConnectivityState state) {
        return switch (state) {
            case CONNECTING -> ConnectivityState.CONNECTING;
            case READY -> ConnectivityState.READY;
            case IDLE -> ConnectivityState.IDLE;
            case TRANSIENT_FAILURE -> ConnectivityState.TRANSIENT_FAILURE;
            case SHUTDOWN -> ConnectivityState.SHUTDOWN;
        };
    }
}
