package com.identity.engine.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tracks fire-and-forget tasks so they can be joined on shutdown.
 *
 * Tasks handle and report their own failures; joining only waits for completion.
 */
public class BackgroundJobs {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobs.class);

    private final Executor executor;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();

    public BackgroundJobs(Executor executor) {
        this.executor = executor;
    }

    /**
     * Run a task on the executor and track it until it completes.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the executor refuses the task
     */
    public CompletableFuture<Void> spawn(Runnable task) {
        CompletableFuture<Void> future = CompletableFuture.runAsync(task, executor);
        inFlight.add(future);
        future.whenComplete((result, error) -> inFlight.remove(future));
        return future;
    }

    /**
     * Wait for every task spawned so far.
     *
     * @throws TimeoutException if tasks are still running when the timeout elapses
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void joinAll(Duration timeout) throws TimeoutException, InterruptedException {
        CompletableFuture<?>[] snapshot = inFlight.toArray(new CompletableFuture<?>[0]);
        if (snapshot.length == 0) {
            return;
        }
        log.debug("Joining {} background tasks (timeout: {})", snapshot.length, timeout);
        try {
            CompletableFuture.allOf(snapshot).get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            // allOf fails only once every task has finished; failures were reported by the tasks
            log.debug("Background task finished with error: {}", e.getCause().getMessage());
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
