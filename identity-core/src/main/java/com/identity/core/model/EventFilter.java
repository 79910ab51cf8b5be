package com.identity.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Selects events from the log. Empty collections mean "no restriction".
 */
public record EventFilter(
    String tenantId,
    AggregateType aggregateType,
    List<String> aggregateIds,
    Set<EventType> eventTypes,
    long fromSequence
) {
    public EventFilter {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        aggregateIds = aggregateIds == null ? List.of() : List.copyOf(aggregateIds);
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static EventFilter forAggregate(String tenantId, AggregateType type, String aggregateId) {
        return new EventFilter(tenantId, type, List.of(aggregateId), Set.of(), 0);
    }

    public EventFilter withEventTypes(Set<EventType> types) {
        return new EventFilter(tenantId, aggregateType, aggregateIds, types, fromSequence);
    }

    /**
     * Only events after the given sequence.
     */
    public EventFilter after(long sequence) {
        return new EventFilter(tenantId, aggregateType, aggregateIds, eventTypes, sequence + 1);
    }

    public boolean matches(Event event) {
        return tenantId.equals(event.tenantId())
            && aggregateType == event.aggregateType()
            && (aggregateIds.isEmpty() || aggregateIds.contains(event.aggregateId()))
            && (eventTypes.isEmpty() || eventTypes.contains(event.eventType()))
            && event.sequence() >= fromSequence;
    }
}
