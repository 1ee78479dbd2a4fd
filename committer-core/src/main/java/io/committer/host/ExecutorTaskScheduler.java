package io.committer.host;

import io.committer.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>{@link #close()} shuts the executor down, cancelling delayed tasks that have not started.
 */
public final class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {
    private final ScheduledExecutorService executor;

    public ExecutorTaskScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Creates a scheduler with a single daemon thread.
     *
     * @param threadPrefix prefix of the thread name
     * @return a new scheduler
     */
    public static ExecutorTaskScheduler singleThreaded(String threadPrefix) {
        return new ExecutorTaskScheduler(
                Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(threadPrefix)));
    }

    @Override
    public Future<?> schedule(Runnable task, long delayMs) {
        Objects.requireNonNull(task, "task");
        return executor.schedule(task, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
