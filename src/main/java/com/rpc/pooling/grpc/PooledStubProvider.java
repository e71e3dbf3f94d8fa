package com.rpc.pooling.grpc;

import com.rpc.pooling.connection.Connection;
import com.rpc.pooling.pool.ConnectionPool;
import io.grpc.Channel;

import java.time.Duration;
import java.util.function.Function;

/**
 * Builds generated gRPC stubs on connections taken from a {@link ConnectionPool}.
 *
 * <pre>
 * PooledStubProvider&lt;UserServiceBlockingStub&gt; users =
 *         new PooledStubProvider&lt;&gt;(pool, UserServiceGrpc::newBlockingStub);
 * User user = users.stub().getUser(request);
 * </pre>
 *
 * @param <S> stub type
 */
public class PooledStubProvider<S> {

    private final ConnectionPool pool;
    private final Function<Channel, S> stubFactory;

    public PooledStubProvider(ConnectionPool pool, Function<Channel, S> stubFactory) {
        this.pool = pool;
        this.stubFactory = stubFactory;
    }

    /**
     * Returns a stub on the next connection in round-robin order. Stubs are cheap;
     * build one per call instead of caching it.
     */
    public S stub() {
        return stubFactory.apply(channelOf(pool.get()));
    }

    /**
     * Returns a stub on a READY or IDLE connection.
     *
     * @throws com.rpc.pooling.pool.NoHealthyConnectionException if none is available within {@code timeout}
     */
    public S healthyStub(Duration timeout) {
        return stubFactory.apply(channelOf(pool.getHealthy(timeout)));
    }

    public ConnectionPool pool() {
        return pool;
    }

    private static Channel channelOf(Connection connection) {
        if (connection instanceof GrpcConnection) {
            return ((GrpcConnection) connection).channel();
        }
        throw new IllegalStateException("Pool connection is not a gRPC channel: " + connection);
    }
}
