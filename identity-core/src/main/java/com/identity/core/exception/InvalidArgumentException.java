package com.identity.core.exception;

/**
 * Thrown for malformed input, excessive nesting or failed verification.
 */
public class InvalidArgumentException extends IdentityException {

    public static final String ERROR_CODE = "INVALID_ARGUMENT";

    public InvalidArgumentException(String id, String localizationKey) {
        super(ERROR_CODE, id, localizationKey);
    }

    public InvalidArgumentException(String id, String localizationKey, Throwable cause) {
        super(ERROR_CODE, id, localizationKey, cause);
    }
}
