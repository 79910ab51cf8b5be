package com.identity.engine.dispatch;

import com.identity.core.model.EventCommand;
import com.identity.core.repository.EventStore;
import com.identity.engine.logging.LoggingContext;
import com.identity.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Appends side-effect events on a background executor.
 *
 * The append runs detached from the calling thread, so an interrupted or returning caller
 * does not abort it; the event store's push timeout bounds each append.
 * Once {@link #shutdown(Duration)} has begun, new dispatches are dropped.
 */
public class AsyncEventDispatcher implements EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventDispatcher.class);

    private final EventStore eventStore;
    private final BackgroundJobs jobs;
    private final Duration shutdownTimeout;
    private final EventStoreMetrics metrics;

    // read: dispatching, write: entering shutdown
    private final ReadWriteLock shutdownLock = new ReentrantReadWriteLock();
    private volatile boolean shuttingDown;

    public AsyncEventDispatcher(
            EventStore eventStore,
            BackgroundJobs jobs,
            Duration shutdownTimeout,
            EventStoreMetrics metrics) {
        this.eventStore = eventStore;
        this.jobs = jobs;
        this.shutdownTimeout = shutdownTimeout;
        this.metrics = metrics;
    }

    @Override
    public void dispatch(String tenantId, EventCommand... commands) {
        if (commands.length == 0) {
            return;
        }
        List<EventCommand> batch = List.of(commands);

        shutdownLock.readLock().lock();
        try {
            if (shuttingDown) {
                for (EventCommand command : batch) {
                    log.warn("Shutdown in progress, dropping event {}", command.eventType().value());
                    metrics.dispatchDropped(command.eventType().value());
                }
                return;
            }
            batch.forEach(command -> metrics.dispatchStarted());
            Map<String, String> context = LoggingContext.capture();
            try {
                jobs.spawn(() -> push(tenantId, batch, context));
            } catch (RejectedExecutionException e) {
                failed(batch, e);
            }
        } finally {
            shutdownLock.readLock().unlock();
        }
    }

    /**
     * Stop accepting dispatches and wait for those in flight.
     *
     * Returns immediately when nothing is in flight. Waits at most the smaller of
     * {@code timeout} and the configured shutdown timeout.
     *
     * @throws TimeoutException if dispatches are still in flight when the wait ends
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void shutdown(Duration timeout) throws TimeoutException, InterruptedException {
        shutdownLock.writeLock().lock();
        try {
            shuttingDown = true;
        } finally {
            shutdownLock.writeLock().unlock();
        }

        Duration bound = timeout.compareTo(shutdownTimeout) < 0 ? timeout : shutdownTimeout;
        int pending = jobs.inFlightCount();
        if (pending > 0) {
            log.info("Waiting for {} side-effect dispatches (timeout: {})", pending, bound);
        }
        jobs.joinAll(bound);
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    public int inFlightCount() {
        return jobs.inFlightCount();
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    // ========== Internal Methods ==========

    private void push(String tenantId, List<EventCommand> batch, Map<String, String> context) {
        LoggingContext.restore(context);
        try {
            eventStore.append(tenantId, batch);
            batch.forEach(command -> metrics.dispatchSucceeded(command.eventType().value()));
        } catch (RuntimeException e) {
            failed(batch, e);
        } finally {
            LoggingContext.clearAll();
        }
    }

    private void failed(List<EventCommand> batch, Exception cause) {
        for (EventCommand command : batch) {
            log.error("could not push event {}", command.eventType().value(), cause);
            metrics.dispatchFailed(command.eventType().value());
        }
    }
}
