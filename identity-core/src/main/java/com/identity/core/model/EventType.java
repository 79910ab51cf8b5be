package com.identity.core.model;

import java.util.Optional;

/**
 * Types of events in the identity event log.
 * Each type belongs to exactly one aggregate type and has a stable wire name.
 */
public enum EventType {

    // Machine user lifecycle
    USER_MACHINE_ADDED(AggregateType.USER, "user.machine.added"),
    USER_MACHINE_CHANGED(AggregateType.USER, "user.machine.changed"),

    // Machine credentials
    USER_MACHINE_SECRET_SET(AggregateType.USER, "user.machine.secret.set"),
    USER_MACHINE_SECRET_REMOVED(AggregateType.USER, "user.machine.secret.removed"),
    USER_MACHINE_SECRET_CHECK_SUCCEEDED(AggregateType.USER, "user.machine.secret.check.succeeded"),
    USER_MACHINE_SECRET_CHECK_FAILED(AggregateType.USER, "user.machine.secret.check.failed"),

    // User state
    USER_DEACTIVATED(AggregateType.USER, "user.deactivated"),
    USER_REACTIVATED(AggregateType.USER, "user.reactivated"),
    USER_REMOVED(AggregateType.USER, "user.removed"),

    // User name claims, one stream per tenant and user name
    USER_NAME_RESERVED(AggregateType.USER_NAME, "user_name.reserved"),
    USER_NAME_RELEASED(AggregateType.USER_NAME, "user_name.released");

    private final AggregateType aggregateType;
    private final String value;

    EventType(AggregateType aggregateType, String value) {
        this.aggregateType = aggregateType;
        this.value = value;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve a persisted wire name. Empty for names this build does not know.
     */
    public static Optional<EventType> fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Check if this event only records an observation and does not change user state.
     */
    public boolean isObservation() {
        return this == USER_MACHINE_SECRET_CHECK_SUCCEEDED || this == USER_MACHINE_SECRET_CHECK_FAILED;
    }
}
