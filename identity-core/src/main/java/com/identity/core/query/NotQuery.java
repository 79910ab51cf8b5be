package com.identity.core.query;

import com.identity.core.exception.InvalidArgumentException;
import java.util.List;

public record NotQuery(SearchQuery query) implements SearchQuery {

    public NotQuery {
        if (query == null) {
            throw new InvalidArgumentException("QUERY-Bk3wq", "Errors.Query.InvalidRequest");
        }
    }

    @Override
    public String toSql(List<Object> args) {
        return "NOT (" + query.toSql(args) + ")";
    }

    @Override
    public boolean matches(SearchableRecord record) {
        return !query.matches(record);
    }
}
