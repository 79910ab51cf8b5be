package com.identity.core.exception;

/**
 * Thrown when a create would violate uniqueness.
 */
public class AlreadyExistsException extends IdentityException {

    public static final String ERROR_CODE = "ALREADY_EXISTS";

    public AlreadyExistsException(String id, String localizationKey) {
        super(ERROR_CODE, id, localizationKey);
    }

    public AlreadyExistsException(String id, String localizationKey, Throwable cause) {
        super(ERROR_CODE, id, localizationKey, cause);
    }
}
