package com.identity.api.middleware;

import java.util.Locale;

/**
 * Resolves localization keys to messages. Supplied by the hosting application.
 */
@FunctionalInterface
public interface Translator {

    String localize(Locale locale, String key);
}
