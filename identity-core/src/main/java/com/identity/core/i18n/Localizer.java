package com.identity.core.i18n;

/**
 * A single piece of user-facing text identified by a localization key.
 * The transport layer resolves the key and writes the rendered message back.
 */
public interface Localizer {

    String localizationKey();

    void setLocalizedMessage(String message);
}
