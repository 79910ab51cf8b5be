package com.identity.engine.command;

import com.identity.core.projection.AccessTokenType;

/**
 * Input for creating a machine user.
 */
public record AddMachine(
    String userId,
    String resourceOwner,
    String userName,
    String name,
    String description,
    AccessTokenType accessTokenType
) {
}
