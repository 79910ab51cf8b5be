package com.identity.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw payload of an event type that has no registered decoder.
 */
public record UnknownPayload(JsonNode raw) implements EventPayload {
}
