package com.rpc.pooling.scheduling;

import java.time.Duration;

/**
 * Runs periodic background work such as the connection repair pass.
 * Abstracted so tests can drive ticks deterministically instead of sleeping.
 */
public interface TaskScheduler {

    /**
     * Schedules {@code task} to run every {@code interval}, first after one interval.
     * A run never overlaps the previous run of the same task.
     *
     * @param name     name used in logs and thread names
     * @param task     the work to run
     * @param interval delay between the end of one run and the start of the next
     * @return a handle that stops future runs
     */
    ScheduledTask scheduleRepeating(String name, Runnable task, Duration interval);
}
