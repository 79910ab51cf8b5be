package com.identity.core.query;

import com.identity.core.exception.InvalidArgumentException;
import java.util.List;

/**
 * Column value is one of the given values. An empty list matches nothing.
 */
public record InListQuery(Column column, List<String> values) implements SearchQuery {

    public InListQuery {
        if (column == null || values == null) {
            throw new InvalidArgumentException("QUERY-Fz9ab", "Errors.Query.InvalidRequest");
        }
        values = List.copyOf(values);
    }

    @Override
    public String toSql(List<Object> args) {
        if (values.isEmpty()) {
            return "1 = 0";
        }
        StringBuilder sql = new StringBuilder(column.identifier()).append(" IN (");
        for (int i = 0; i < values.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
            args.add(values.get(i));
        }
        return column.wrap(sql.append(')').toString());
    }

    @Override
    public boolean matches(SearchableRecord record) {
        for (String candidate : record.values(column)) {
            if (values.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
