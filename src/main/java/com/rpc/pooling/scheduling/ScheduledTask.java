package com.rpc.pooling.scheduling;

/**
 * Handle to a task registered with a {@link TaskScheduler}.
 */
public interface ScheduledTask {

    /**
     * Prevents any further run of the task. A run already in progress is not interrupted.
     */
    void cancel();

    boolean isCancelled();
}
