package com.identity.core.query;

import com.identity.core.exception.InvalidArgumentException;
import java.util.List;

public record TextQuery(Column column, String value, TextComparison comparison) implements SearchQuery {

    public TextQuery {
        if (column == null || comparison == null) {
            throw new InvalidArgumentException("QUERY-7m0Yx", "Errors.Query.InvalidRequest");
        }
        if (value == null) {
            throw new InvalidArgumentException("QUERY-eE4Ks", "Errors.Query.EmptyValue");
        }
    }

    @Override
    public String toSql(List<Object> args) {
        args.add(comparison.bindValue(value));
        return column.wrap(comparison.sql(column.identifier()));
    }

    @Override
    public boolean matches(SearchableRecord record) {
        for (String candidate : record.values(column)) {
            if (comparison.test(candidate, value)) {
                return true;
            }
        }
        return false;
    }
}
