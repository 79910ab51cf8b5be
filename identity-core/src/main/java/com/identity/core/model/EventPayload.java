package com.identity.core.model;

/**
 * Marker for decoded event payloads.
 */
public interface EventPayload {
}
