package com.rpc.pooling.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService} of daemon threads.
 *
 * <p>Tasks use fixed-delay scheduling, so a slow run pushes the next one back instead of
 * overlapping it. A run that throws is logged and the task keeps its schedule.</p>
 */
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorTaskScheduler(String threadNamePrefix) {
        this(threadNamePrefix, 1);
    }

    public ExecutorTaskScheduler(String threadNamePrefix, int threads) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        this.executor = new ScheduledThreadPoolExecutor(threads, daemonThreads(threadNamePrefix));
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public ScheduledTask scheduleRepeating(String name, Runnable task, Duration interval) {
        long nanos = interval.toNanos();
        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
                () -> runSafely(name, task), nanos, nanos, TimeUnit.NANOSECONDS);
        log.debug("Scheduled task {} every {}", name, interval);
        return new FutureTask(future);
    }

    /**
     * Stops the executor. Tasks still registered are cancelled.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    private static void runSafely(String name, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Scheduled task {} failed", name, e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record FutureTask(ScheduledFuture<?> future) implements ScheduledTask {

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
