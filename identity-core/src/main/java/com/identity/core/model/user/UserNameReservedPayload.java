package com.identity.core.model.user;

import com.identity.core.model.EventPayload;

/**
 * A user name was claimed by the given user.
 */
public record UserNameReservedPayload(String userId) implements EventPayload {
}
