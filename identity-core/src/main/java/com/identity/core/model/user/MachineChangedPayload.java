package com.identity.core.model.user;

import com.identity.core.model.EventPayload;
import com.identity.core.projection.AccessTokenType;

/**
 * Changed fields of a machine user. Null means unchanged.
 */
public record MachineChangedPayload(
    String name,
    String description,
    AccessTokenType accessTokenType
) implements EventPayload {

    public boolean hasChanges() {
        return name != null || description != null || accessTokenType != null;
    }
}
