package com.rpc.pooling.grpc;

import io.grpc.ManagedChannelBuilder;

/**
 * Extra pool option that adjusts a gRPC channel builder before the channel is built,
 * e.g. to set a user agent or a load-balancing policy.
 */
@FunctionalInterface
public interface GrpcChannelCustomizer {

    void customize(ManagedChannelBuilder<?> builder);
}
