package com.rpc.pooling.pool;

import java.util.List;

/**
 * Aggregates every failure raised while closing a set of resources.
 * Each individual failure is attached as a suppressed exception.
 */
public class PoolCloseException extends RuntimeException {

    public PoolCloseException(String message, List<? extends Throwable> failures) {
        super(message + ": " + failures.size() + " failure(s)",
                failures.isEmpty() ? null : failures.get(0));
        for (Throwable failure : failures) {
            addSuppressed(failure);
        }
    }

    /**
     * Returns the individual failures in the order they occurred.
     */
    public List<Throwable> getFailures() {
        return List.of(getSuppressed());
    }
}
