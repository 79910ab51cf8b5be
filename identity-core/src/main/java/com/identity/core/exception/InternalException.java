package com.identity.core.exception;

/**
 * Thrown for storage, decoding and crypto failures not caused by caller input.
 */
public class InternalException extends IdentityException {

    public static final String ERROR_CODE = "INTERNAL";

    public InternalException(String id, String localizationKey) {
        super(ERROR_CODE, id, localizationKey);
    }

    public InternalException(String id, String localizationKey, Throwable cause) {
        super(ERROR_CODE, id, localizationKey, cause);
    }
}
