package com.identity.core.writemodel;

import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventFilter;
import com.identity.core.model.EventType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Base for transient per-command aggregate state.
 *
 * Subclasses implement {@link #apply(Event)} as a pure function of the event.
 * Reduction is deterministic: the same events always produce the same state.
 */
public abstract class WriteModel implements AppendReducer {

    private final String tenantId;
    private final String aggregateId;
    private final List<Event> pending = new ArrayList<>();

    private String resourceOwner;
    private long processedSequence;
    private Instant changeDate;

    protected WriteModel(String tenantId, String aggregateId) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
    }

    protected abstract AggregateType aggregateType();

    /**
     * Event types this model reads. Empty means all types of the aggregate.
     * A narrowed set makes {@link #getProcessedSequence()} lag behind the aggregate,
     * so such models cannot be used for sequence checks.
     */
    protected Set<EventType> eventTypes() {
        return Set.of();
    }

    /**
     * Apply one event to state. Called in strictly increasing sequence order.
     */
    protected abstract void apply(Event event);

    @Override
    public EventFilter query() {
        return EventFilter.forAggregate(tenantId, aggregateType(), aggregateId)
            .withEventTypes(eventTypes())
            .after(processedSequence);
    }

    @Override
    public void appendEvents(List<Event> events) {
        pending.addAll(events);
    }

    @Override
    public void reduce() {
        if (pending.isEmpty()) {
            return;
        }
        List<Event> ordered = new ArrayList<>(pending);
        pending.clear();
        ordered.sort(Comparator.comparingLong(Event::sequence));

        for (Event event : ordered) {
            if (!aggregateId.equals(event.aggregateId()) || !tenantId.equals(event.tenantId())) {
                throw new IllegalStateException(String.format(
                    "Event %s belongs to %s/%s, model is %s/%s",
                    event.eventId(), event.tenantId(), event.aggregateId(), tenantId, aggregateId));
            }
            if (event.sequence() <= processedSequence) {
                throw new IllegalStateException(String.format(
                    "Event sequence %d of aggregate %s is not after processed sequence %d",
                    event.sequence(), aggregateId, processedSequence));
            }
            apply(event);
            processedSequence = event.sequence();
            changeDate = event.timestamp();
            if (event.resourceOwner() != null) {
                resourceOwner = event.resourceOwner();
            }
        }
    }

    // ========== Accessors ==========

    public String getTenantId() {
        return tenantId;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public String getResourceOwner() {
        return resourceOwner;
    }

    /**
     * Sequence of the last event folded into this model, 0 if none.
     */
    public long getProcessedSequence() {
        return processedSequence;
    }

    public Instant getChangeDate() {
        return changeDate;
    }
}
