package com.rpc.pooling.manager;

/**
 * Thrown when the pool for a named service cannot be constructed.
 * The underlying failure is kept as the cause.
 */
public class PoolCreationException extends RuntimeException {

    private final String serviceName;

    public PoolCreationException(String serviceName, Throwable cause) {
        super("Failed to create pool for " + serviceName + ": " + cause.getMessage(), cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
