package com.identity.core.model;

/**
 * Payload of events that carry no data beyond their type.
 */
public record EmptyPayload() implements EventPayload {

    public static final EmptyPayload INSTANCE = new EmptyPayload();
}
