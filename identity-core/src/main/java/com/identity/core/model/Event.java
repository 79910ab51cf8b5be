package com.identity.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened to an aggregate.
 * Append-only; events are never updated or deleted.
 *
 * Unique key: (tenantId, aggregateType, aggregateId, sequence)
 *
 * Invariants:
 * - sequence starts at 1 and is contiguous within an aggregate
 * - sequence is assigned by the event store at append time
 */
public record Event(
    // Primary key
    UUID eventId,

    // Stream identity
    String tenantId,
    String aggregateId,
    AggregateType aggregateType,
    String resourceOwner,

    // Ordering
    long sequence,

    // Event data
    EventType eventType,
    EventPayload payload,

    // Attribution
    String actorId,
    Instant timestamp
) {
    /**
     * Actor recorded for events the system emits on its own behalf.
     */
    public static final String ACTOR_SYSTEM = "SYSTEM";

    /**
     * Get the payload cast to the expected type.
     */
    public <T extends EventPayload> T payloadAs(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(String.format(
                "Event %s (%s) has payload %s, expected %s",
                eventId, eventType.value(), payload == null ? "null" : payload.getClass().getSimpleName(),
                type.getSimpleName()));
        }
        return type.cast(payload);
    }
}
