package com.rpc.pooling.pool;

/**
 * Thrown by {@link ConnectionPool#getHealthy} when no connection became READY or IDLE
 * before the timeout expired. Callers may retry later or fail the request.
 */
public class NoHealthyConnectionException extends RuntimeException {

    private final String target;

    public NoHealthyConnectionException(String target, String message) {
        super(message);
        this.target = target;
    }

    public NoHealthyConnectionException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
