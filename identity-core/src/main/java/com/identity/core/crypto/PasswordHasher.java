package com.identity.core.crypto;

/**
 * One-way hashing of secrets.
 */
public interface PasswordHasher {

    String hash(String raw);

    /**
     * Verify a secret against a stored hash.
     *
     * @throws HashVerificationException if the secret does not match or the hash is malformed
     */
    void verify(String encoded, String raw) throws HashVerificationException;
}
