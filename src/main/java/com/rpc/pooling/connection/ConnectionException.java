package com.rpc.pooling.connection;

/**
 * Runtime exception thrown when a connection cannot be dialed or closed.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
