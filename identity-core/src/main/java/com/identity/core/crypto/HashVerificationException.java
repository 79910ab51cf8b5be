package com.identity.core.crypto;

/**
 * Raised when a secret does not match its hash, or the hash cannot be evaluated.
 */
public class HashVerificationException extends Exception {

    public HashVerificationException(String message) {
        super(message);
    }

    public HashVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
