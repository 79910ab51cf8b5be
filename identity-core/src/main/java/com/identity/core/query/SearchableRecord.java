package com.identity.core.query;

import java.util.Collection;

/**
 * Projection row that can be evaluated against a {@link SearchQuery} in memory.
 */
public interface SearchableRecord {

    /**
     * Values of the column for this record. Multi-valued columns (login names) return all of them;
     * absent values return an empty collection.
     */
    Collection<String> values(Column column);
}
