package com.identity.engine.lifecycle;

import com.identity.engine.dispatch.AsyncEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.util.concurrent.TimeoutException;

/**
 * Manages graceful shutdown for the identity engine.
 *
 * On shutdown:
 * 1. Stops accepting new side-effect events
 * 2. Waits for in-flight side-effect events to be appended (with timeout)
 * 3. Logs shutdown status
 */
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final AsyncEventDispatcher dispatcher;

    public GracefulShutdownHandler(AsyncEventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return dispatcher.isShuttingDown();
    }

    /**
     * Handle application shutdown event.
     * Runs before the executor and data source beans are destroyed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0)
    public void onShutdown(ContextClosedEvent event) {
        log.info("Initiating graceful shutdown with {} side-effect events in flight", dispatcher.inFlightCount());
        try {
            dispatcher.shutdown(dispatcher.getShutdownTimeout());
            log.info("Graceful shutdown complete");
        } catch (TimeoutException e) {
            log.warn("Shutdown timeout reached with {} side-effect events still in flight",
                dispatcher.inFlightCount());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for side-effect events");
        }
    }
}
