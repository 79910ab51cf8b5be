package com.identity.core.projection;

/**
 * Machine (service account) part of a user.
 *
 * @param secretHash hashed client secret, null when no secret is configured
 */
public record Machine(
    String name,
    String description,
    String secretHash,
    AccessTokenType accessTokenType
) {
    public boolean hasSecret() {
        return secretHash != null && !secretHash.isEmpty();
    }

    @Override
    public String toString() {
        return "Machine[name=" + name + ", description=" + description
            + ", secretHash=" + (hasSecret() ? "***" : "null") + ", accessTokenType=" + accessTokenType + "]";
    }
}
