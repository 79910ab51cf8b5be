package com.identity.core.exception;

import com.identity.core.i18n.Localizer;

/**
 * Base exception for all identity engine errors.
 *
 * Every error carries:
 * - errorCode: the kind of failure (NOT_FOUND, INTERNAL, ...), used by transports to pick a status
 * - id: a stable identifier of the place that raised it, e.g. "QUERY-wu6Ee"
 * - localizationKey: the message key rendered by the localization collaborator
 */
public class IdentityException extends RuntimeException implements Localizer {

    private final String errorCode;
    private final String id;
    private final String localizationKey;
    private volatile String localizedMessage;

    public IdentityException(String errorCode, String id, String localizationKey) {
        this(errorCode, id, localizationKey, null);
    }

    public IdentityException(String errorCode, String id, String localizationKey, Throwable cause) {
        super(String.format("%s (%s)", localizationKey, id), cause);
        this.errorCode = errorCode;
        this.id = id;
        this.localizationKey = localizationKey;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getId() {
        return id;
    }

    @Override
    public String localizationKey() {
        return localizationKey;
    }

    @Override
    public void setLocalizedMessage(String message) {
        this.localizedMessage = message;
    }

    /**
     * Returns the translated message if one was set, otherwise the raw key and id.
     */
    @Override
    public String getLocalizedMessage() {
        String localized = localizedMessage;
        return localized != null ? localized : getMessage();
    }
}
