package com.identity.core.model.user;

import com.identity.core.model.EventPayload;
import com.identity.core.projection.AccessTokenType;

public record MachineAddedPayload(
    String userName,
    String name,
    String description,
    AccessTokenType accessTokenType
) implements EventPayload {
}
