package com.identity.core.query;

import java.util.List;

/**
 * Node of a query predicate tree.
 *
 * Each node renders itself as a parameterized SQL fragment for the JDBC readers
 * and evaluates itself against records for the in-memory readers.
 */
public interface SearchQuery {

    /**
     * Render this predicate, appending bind parameters to {@code args} in order.
     */
    String toSql(List<Object> args);

    boolean matches(SearchableRecord record);
}
