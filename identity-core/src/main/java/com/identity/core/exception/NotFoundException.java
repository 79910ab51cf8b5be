package com.identity.core.exception;

/**
 * Thrown when a queried entity does not exist.
 */
public class NotFoundException extends IdentityException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String id, String localizationKey) {
        super(ERROR_CODE, id, localizationKey);
    }

    public NotFoundException(String id, String localizationKey, Throwable cause) {
        super(ERROR_CODE, id, localizationKey, cause);
    }
}
