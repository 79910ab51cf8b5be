package com.identity.core.query;

import java.util.Locale;

/**
 * Text comparison operators supported by {@link TextQuery}.
 */
public enum TextComparison {
    EQUALS,
    EQUALS_IGNORE_CASE,
    STARTS_WITH,
    STARTS_WITH_IGNORE_CASE,
    CONTAINS,
    CONTAINS_IGNORE_CASE,
    ENDS_WITH,
    ENDS_WITH_IGNORE_CASE;

    public boolean ignoresCase() {
        return switch (this) {
            case EQUALS_IGNORE_CASE, STARTS_WITH_IGNORE_CASE, CONTAINS_IGNORE_CASE, ENDS_WITH_IGNORE_CASE -> true;
            default -> false;
        };
    }

    public boolean test(String candidate, String value) {
        if (candidate == null) {
            return false;
        }
        String left = ignoresCase() ? candidate.toLowerCase(Locale.ROOT) : candidate;
        String right = ignoresCase() ? value.toLowerCase(Locale.ROOT) : value;
        return switch (this) {
            case EQUALS, EQUALS_IGNORE_CASE -> left.equals(right);
            case STARTS_WITH, STARTS_WITH_IGNORE_CASE -> left.startsWith(right);
            case CONTAINS, CONTAINS_IGNORE_CASE -> left.contains(right);
            case ENDS_WITH, ENDS_WITH_IGNORE_CASE -> left.endsWith(right);
        };
    }

    /**
     * SQL comparison of {@code column} against one bind parameter.
     * LIKE wildcards in the value are escaped by {@link #bindValue(String)}.
     */
    String sql(String column) {
        return switch (this) {
            case EQUALS -> column + " = ?";
            case EQUALS_IGNORE_CASE -> "LOWER(" + column + ") = LOWER(?)";
            case STARTS_WITH, CONTAINS, ENDS_WITH -> column + " LIKE ? ESCAPE '\\'";
            case STARTS_WITH_IGNORE_CASE, CONTAINS_IGNORE_CASE, ENDS_WITH_IGNORE_CASE ->
                "LOWER(" + column + ") LIKE LOWER(?) ESCAPE '\\'";
        };
    }

    Object bindValue(String value) {
        String escaped = value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return switch (this) {
            case EQUALS, EQUALS_IGNORE_CASE -> value;
            case STARTS_WITH, STARTS_WITH_IGNORE_CASE -> escaped + "%";
            case CONTAINS, CONTAINS_IGNORE_CASE -> "%" + escaped + "%";
            case ENDS_WITH, ENDS_WITH_IGNORE_CASE -> "%" + escaped;
        };
    }
}
