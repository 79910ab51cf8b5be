package com.identity.core.query;

/**
 * A searchable attribute of a projection.
 */
public interface Column {

    /**
     * SQL expression of the column in its projection table.
     */
    String identifier();

    /**
     * Wrap a comparison on {@link #identifier()} into the final predicate.
     * Columns stored outside the main table override this with a sub-select.
     */
    default String wrap(String comparisonSql) {
        return comparisonSql;
    }
}
