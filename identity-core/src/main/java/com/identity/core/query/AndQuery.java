package com.identity.core.query;

import com.identity.core.exception.InvalidArgumentException;
import java.util.List;

public record AndQuery(List<SearchQuery> queries) implements SearchQuery {

    public AndQuery {
        if (queries == null || queries.isEmpty()) {
            throw new InvalidArgumentException("QUERY-4Kd9a", "Errors.Query.InvalidRequest");
        }
        queries = List.copyOf(queries);
    }

    @Override
    public String toSql(List<Object> args) {
        return CompositeSql.join(queries, " AND ", args);
    }

    @Override
    public boolean matches(SearchableRecord record) {
        for (SearchQuery query : queries) {
            if (!query.matches(record)) {
                return false;
            }
        }
        return true;
    }
}
