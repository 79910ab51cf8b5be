package com.identity.core.query;

import com.identity.core.exception.InvalidArgumentException;
import java.util.List;

public record OrQuery(List<SearchQuery> queries) implements SearchQuery {

    public OrQuery {
        if (queries == null || queries.isEmpty()) {
            throw new InvalidArgumentException("QUERY-pL2xN", "Errors.Query.InvalidRequest");
        }
        queries = List.copyOf(queries);
    }

    @Override
    public String toSql(List<Object> args) {
        return CompositeSql.join(queries, " OR ", args);
    }

    @Override
    public boolean matches(SearchableRecord record) {
        for (SearchQuery query : queries) {
            if (query.matches(record)) {
                return true;
            }
        }
        return false;
    }
}
