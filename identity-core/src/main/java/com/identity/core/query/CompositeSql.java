package com.identity.core.query;

import java.util.List;

final class CompositeSql {

    private CompositeSql() {
    }

    static String join(List<SearchQuery> queries, String operator, List<Object> args) {
        StringBuilder sql = new StringBuilder("(");
        for (int i = 0; i < queries.size(); i++) {
            if (i > 0) {
                sql.append(operator);
            }
            sql.append(queries.get(i).toSql(args));
        }
        return sql.append(')').toString();
    }
}
