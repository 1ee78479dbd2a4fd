package io.committer.host;

import java.util.concurrent.Future;

/**
 * Runs a task after a delay. Used by the host to pace retries.
 *
 * @see ExecutorTaskScheduler
 */
@FunctionalInterface
public interface TaskScheduler {

    /**
     * Schedules a task.
     *
     * @param task    the task
     * @param delayMs delay in milliseconds (non-negative)
     * @return a handle that cancels the task if it has not started
     * @throws java.util.concurrent.RejectedExecutionException if the scheduler is shut down
     */
    Future<?> schedule(Runnable task, long delayMs);
}
