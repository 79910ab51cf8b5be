package com.identity.api.user;

import com.identity.core.query.TextComparison;

/**
 * Text match methods accepted in external user filters.
 */
public enum TextMethod {
    EQUALS(TextComparison.EQUALS),
    EQUALS_IGNORE_CASE(TextComparison.EQUALS_IGNORE_CASE),
    STARTS_WITH(TextComparison.STARTS_WITH),
    STARTS_WITH_IGNORE_CASE(TextComparison.STARTS_WITH_IGNORE_CASE),
    CONTAINS(TextComparison.CONTAINS),
    CONTAINS_IGNORE_CASE(TextComparison.CONTAINS_IGNORE_CASE),
    ENDS_WITH(TextComparison.ENDS_WITH),
    ENDS_WITH_IGNORE_CASE(TextComparison.ENDS_WITH_IGNORE_CASE);

    private final TextComparison comparison;

    TextMethod(TextComparison comparison) {
        this.comparison = comparison;
    }

    /**
     * Internal comparison for this method. A missing method means exact match.
     */
    public static TextComparison toComparison(TextMethod method) {
        return method == null ? TextComparison.EQUALS : method.comparison;
    }
}
