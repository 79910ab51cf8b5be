package com.identity.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics for the event store and the side-effect dispatcher.
 *
 * Metrics exposed:
 * - Appended events by aggregate type
 * - Concurrency conflicts by aggregate type
 * - Append latency
 * - Side-effect dispatch outcomes by event type
 * - In-flight side-effect dispatches
 *
 * Recording before {@link #bindTo(MeterRegistry)} is a no-op.
 */
public class EventStoreMetrics implements MeterBinder {

    // Metric names
    public static final String EVENTS_APPENDED = "identity.eventstore.events.appended";
    public static final String APPEND_CONFLICTS = "identity.eventstore.conflicts";
    public static final String APPEND_DURATION = "identity.eventstore.append.duration";
    public static final String DISPATCH_OUTCOMES = "identity.dispatcher.events";
    public static final String DISPATCH_IN_FLIGHT = "identity.dispatcher.in_flight";

    private volatile MeterRegistry registry;

    private final AtomicInteger inFlight = new AtomicInteger(0);

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(DISPATCH_IN_FLIGHT, inFlight, AtomicInteger::get)
            .description("Side-effect events waiting to be appended")
            .register(registry);
    }

    // ========== Event Store Metrics ==========

    public void eventsAppended(String aggregateType, int count, Duration duration) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(EVENTS_APPENDED)
            .tag("aggregate_type", aggregateType)
            .description("Total events appended")
            .register(registry)
            .increment(count);

        Timer.builder(APPEND_DURATION)
            .tag("outcome", "success")
            .description("Append duration")
            .register(registry)
            .record(duration);
    }

    public void conflict(String aggregateType) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(APPEND_CONFLICTS)
            .tag("aggregate_type", aggregateType)
            .description("Appends rejected because the aggregate advanced")
            .register(registry)
            .increment();
    }

    // ========== Dispatcher Metrics ==========

    public void dispatchStarted() {
        inFlight.incrementAndGet();
    }

    public void dispatchSucceeded(String eventType) {
        inFlight.decrementAndGet();
        dispatchOutcome(eventType, "success");
    }

    public void dispatchFailed(String eventType) {
        inFlight.decrementAndGet();
        dispatchOutcome(eventType, "failure");
    }

    /**
     * Dispatch refused because shutdown has begun. Never counted as in flight.
     */
    public void dispatchDropped(String eventType) {
        dispatchOutcome(eventType, "dropped");
    }

    public int getInFlight() {
        return inFlight.get();
    }

    private void dispatchOutcome(String eventType, String outcome) {
        MeterRegistry registry = this.registry;
        if (registry == null) {
            return;
        }
        Counter.builder(DISPATCH_OUTCOMES)
            .tag("event_type", eventType)
            .tag("outcome", outcome)
            .description("Side-effect events by outcome")
            .register(registry)
            .increment();
    }
}
