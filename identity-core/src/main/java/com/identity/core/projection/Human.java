package com.identity.core.projection;

/**
 * Profile of a human user.
 */
public record Human(
    String firstName,
    String lastName,
    String nickName,
    String displayName,
    String preferredLanguage,
    String email,
    boolean emailVerified,
    String phone,
    boolean phoneVerified
) {
}
