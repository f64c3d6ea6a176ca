package com.p14n.eventsource.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Interface for asynchronous task execution. The broker runs its coordinator
 * loop and its replay tasks through this.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Shuts down the executor and returns a list of runnables that were not
     * executed.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    /**
     * Submits a task for execution and returns a Future representing the pending
     * result.
     *
     * @param task The task to submit
     * @param <T>  The type of the task result
     * @return A Future representing pending completion of the task
     * @throws java.util.concurrent.RejectedExecutionException if the executor
     *                                                         has been shut down
     */
    <T> Future<T> submit(Callable<T> task);

}
