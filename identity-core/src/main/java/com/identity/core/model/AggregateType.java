package com.identity.core.model;

/**
 * Kind of entity an event stream belongs to.
 */
public enum AggregateType {
    USER("user"),
    USER_NAME("user_name"),
    PROJECT("project"),
    ORG("org"),
    INSTANCE("instance");

    private final String value;

    AggregateType(String value) {
        this.value = value;
    }

    /**
     * Stable name as persisted in the event log.
     */
    public String value() {
        return value;
    }

    public static AggregateType fromValue(String value) {
        for (AggregateType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate type: " + value);
    }
}
