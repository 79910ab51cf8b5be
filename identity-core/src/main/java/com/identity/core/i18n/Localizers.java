package com.identity.core.i18n;

import java.util.List;

/**
 * Implemented by result objects that carry more than one localizable field.
 */
public interface Localizers {

    List<Localizer> localizers();
}
