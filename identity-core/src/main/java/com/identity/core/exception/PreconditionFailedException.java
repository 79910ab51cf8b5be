package com.identity.core.exception;

/**
 * Thrown when a required sub-state is missing, e.g. no secret configured.
 */
public class PreconditionFailedException extends IdentityException {

    public static final String ERROR_CODE = "PRECONDITION_FAILED";

    public PreconditionFailedException(String id, String localizationKey) {
        super(ERROR_CODE, id, localizationKey);
    }

    public PreconditionFailedException(String id, String localizationKey, Throwable cause) {
        super(ERROR_CODE, id, localizationKey, cause);
    }
}
