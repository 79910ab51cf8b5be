package com.identity.api.middleware;

import com.identity.core.exception.IdentityException;
import com.identity.core.i18n.Localizer;
import com.identity.core.i18n.Localizers;

import java.util.Locale;

/**
 * Back-fills localized messages into results and errors on their way out.
 * Without a translator everything passes through unchanged.
 */
public class LocalizationTranslator {

    private final Translator translator;

    public LocalizationTranslator(Translator translator) {
        this.translator = translator;
    }

    public void translateFields(Locale locale, Localizers object) {
        if (translator == null || object == null) {
            return;
        }
        for (Localizer field : object.localizers()) {
            field.setLocalizedMessage(translator.localize(locale, field.localizationKey()));
        }
    }

    /**
     * Localize the first {@link IdentityException} in the cause chain.
     *
     * @return the error passed in
     */
    public <T extends Throwable> T translateError(Locale locale, T error) {
        if (translator == null || error == null) {
            return error;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof IdentityException) {
                IdentityException identityError = (IdentityException) current;
                identityError.setLocalizedMessage(translator.localize(locale, identityError.localizationKey()));
                break;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return error;
    }
}
