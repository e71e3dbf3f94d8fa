package com.rpc.pooling.grpc;

import com.rpc.pooling.connection.Connection;
import com.rpc.pooling.connection.ConnectionException;
import com.rpc.pooling.connection.ConnectionFactory;
import com.rpc.pooling.connection.TransportOptions;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ChannelCredentials;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannelBuilder;
import io.grpc.MethodDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * {@link ConnectionFactory} that opens gRPC channels.
 *
 * <p>Channels use plaintext unless a {@link ChannelCredentials} extra option is given.
 * Other understood extra options are {@link ClientInterceptor} and
 * {@link GrpcChannelCustomizer}; any other option type fails the dial.
 * Max connection age and its grace period are server-side settings in gRPC and are
 * not applied to client channels.</p>
 */
public class GrpcConnectionFactory implements ConnectionFactory {
    private static final Logger log = LoggerFactory.getLogger(GrpcConnectionFactory.class);

    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final BiFunction<String, ChannelCredentials, ManagedChannelBuilder<?>> builderSource;
    private final Duration closeTimeout;

    public GrpcConnectionFactory() {
        this(DEFAULT_CLOSE_TIMEOUT);
    }

    public GrpcConnectionFactory(Duration closeTimeout) {
        this(Grpc::newChannelBuilder, closeTimeout);
    }

    /**
     * @param builderSource creates the channel builder for a target and credentials
     * @param closeTimeout  time granted to in-flight calls when a connection is closed
     */
    public GrpcConnectionFactory(BiFunction<String, ChannelCredentials, ManagedChannelBuilder<?>> builderSource,
                                 Duration closeTimeout) {
        this.builderSource = builderSource;
        this.closeTimeout = closeTimeout;
    }

    @Override
    public Connection connect(String target, TransportOptions options) {
        ChannelCredentials credentials = InsecureChannelCredentials.create();
        List<ClientInterceptor> interceptors = new ArrayList<>();
        List<GrpcChannelCustomizer> customizers = new ArrayList<>();
        for (Object option : options.extraOptions()) {
            if (option instanceof ChannelCredentials) {
                credentials = (ChannelCredentials) option;
            } else if (option instanceof ClientInterceptor) {
                interceptors.add((ClientInterceptor) option);
            } else if (option instanceof GrpcChannelCustomizer) {
                customizers.add((GrpcChannelCustomizer) option);
            } else {
                throw new ConnectionException("Unsupported gRPC channel option for " + target + ": "
                        + option.getClass().getName());
            }
        }

        try {
            ManagedChannelBuilder<?> builder = builderSource.apply(target, credentials);
            if (isPositive(options.keepaliveTime())) {
                builder.keepAliveTime(options.keepaliveTime().toMillis(), TimeUnit.MILLISECONDS)
                        .keepAliveWithoutCalls(true);
            }
            if (isPositive(options.keepaliveTimeout())) {
                builder.keepAliveTimeout(options.keepaliveTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (isPositive(options.maxConnectionIdle())) {
                builder.idleTimeout(options.maxConnectionIdle().toMillis(), TimeUnit.MILLISECONDS);
            }
            builder.maxInboundMessageSize(options.maxMessageSize());
            interceptors.add(maxOutboundMessageSize(options.maxMessageSize()));
            builder.intercept(interceptors);
            for (GrpcChannelCustomizer customizer : customizers) {
                customizer.customize(builder);
            }

            log.debug("Opening gRPC channel to {} (keepalive={}, idle={}, maxMessageSize={}, "
                            + "maxAge={} and maxAgeGrace={} left to the server)",
                    target, options.keepaliveTime(), options.maxConnectionIdle(), options.maxMessageSize(),
                    options.maxConnectionAge(), options.maxConnectionAgeGrace());
            return new GrpcConnection(target, builder.build(), closeTimeout);
        } catch (RuntimeException e) {
            throw new ConnectionException("Failed to create gRPC channel to " + target, e);
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private static ClientInterceptor maxOutboundMessageSize(int maxMessageSize) {
        return new ClientInterceptor() {
            @Override
            public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
                    MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
                return next.newCall(method, callOptions.withMaxOutboundMessageSize(maxMessageSize));
            }
        };
    }
}
