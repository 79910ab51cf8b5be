package com.identity.core.model;

import java.util.Objects;

/**
 * Intent to append one event. The event store assigns sequence, id and timestamp.
 *
 * @param expectedSequence sequence the caller reduced the aggregate to, or {@link #ANY_SEQUENCE}
 */
public record EventCommand(
    String aggregateId,
    AggregateType aggregateType,
    String resourceOwner,
    EventType eventType,
    EventPayload payload,
    String actorId,
    long expectedSequence
) {
    /**
     * Append without checking the current sequence of the aggregate.
     */
    public static final long ANY_SEQUENCE = -1L;

    public EventCommand {
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(eventType, "eventType");
        if (eventType.aggregateType() != aggregateType) {
            throw new IllegalArgumentException(String.format(
                "Event type %s does not belong to aggregate type %s", eventType.value(), aggregateType.value()));
        }
        if (payload == null) {
            payload = EmptyPayload.INSTANCE;
        }
    }

    public static EventCommand forUser(
            String userId, String resourceOwner, EventType type, EventPayload payload,
            String actorId, long expectedSequence) {
        return new EventCommand(userId, AggregateType.USER, resourceOwner, type, payload, actorId, expectedSequence);
    }

    /**
     * Command on the claim stream of a user name. The user name is the aggregate id.
     */
    public static EventCommand forUserName(
            String userName, String resourceOwner, EventType type, EventPayload payload,
            String actorId, long expectedSequence) {
        return new EventCommand(userName, AggregateType.USER_NAME, resourceOwner, type, payload, actorId, expectedSequence);
    }

    public boolean checksSequence() {
        return expectedSequence != ANY_SEQUENCE;
    }
}
