package com.identity.core.query;

/**
 * Searchable columns of the user projection.
 */
public enum UserColumn implements Column {
    ID("id"),
    USER_NAME("user_name"),
    FIRST_NAME("first_name"),
    LAST_NAME("last_name"),
    NICK_NAME("nick_name"),
    DISPLAY_NAME("display_name"),
    EMAIL("email"),
    STATE("state"),
    TYPE("type"),
    RESOURCE_OWNER("resource_owner"),
    LOGIN_NAME("login_name") {
        @Override
        public String wrap(String comparisonSql) {
            return "id IN (SELECT user_id FROM projections.login_names WHERE tenant_id = users.tenant_id AND "
                + comparisonSql + ")";
        }
    };

    private final String identifier;

    UserColumn(String identifier) {
        this.identifier = identifier;
    }

    @Override
    public String identifier() {
        return identifier;
    }
}
