package com.identity.core.projection;

/**
 * Format of access tokens issued to a machine user.
 */
public enum AccessTokenType {
    BEARER,
    JWT
}
