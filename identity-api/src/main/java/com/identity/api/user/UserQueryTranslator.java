package com.identity.api.user;

import com.identity.core.exception.InvalidArgumentException;
import com.identity.core.query.AndQuery;
import com.identity.core.query.InListQuery;
import com.identity.core.query.NotQuery;
import com.identity.core.query.OrQuery;
import com.identity.core.query.SearchQuery;
import com.identity.core.query.TextComparison;
import com.identity.core.query.TextQuery;
import com.identity.core.query.UserColumn;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates external user filters into search predicates.
 *
 * Nesting is bounded: the level is checked before descending, so a hostile, deeply nested
 * filter fails after at most {@link #MAX_NESTING_LEVEL} steps.
 */
public final class UserQueryTranslator {

    public static final int MAX_NESTING_LEVEL = 20;

    private UserQueryTranslator() {
    }

    public static List<SearchQuery> toQueries(List<UserSearchFilter> filters, int level) {
        if (filters == null) {
            return List.of();
        }
        List<SearchQuery> queries = new ArrayList<>(filters.size());
        for (UserSearchFilter filter : filters) {
            queries.add(toQuery(filter, level));
        }
        return queries;
    }

    /**
     * @throws InvalidArgumentException if the filter nests deeper than allowed or is of an unknown kind
     */
    public static SearchQuery toQuery(UserSearchFilter filter, int level) {
        if (level > MAX_NESTING_LEVEL) {
            throw new InvalidArgumentException("USER-zsQ97", "Errors.User.TooManyNestingLevels");
        }
        if (filter instanceof UserSearchFilter.UserName) {
            UserSearchFilter.UserName q = (UserSearchFilter.UserName) filter;
            return text(UserColumn.USER_NAME, q.userName(), q.method());
        }
        if (filter instanceof UserSearchFilter.FirstName) {
            UserSearchFilter.FirstName q = (UserSearchFilter.FirstName) filter;
            return text(UserColumn.FIRST_NAME, q.firstName(), q.method());
        }
        if (filter instanceof UserSearchFilter.LastName) {
            UserSearchFilter.LastName q = (UserSearchFilter.LastName) filter;
            return text(UserColumn.LAST_NAME, q.lastName(), q.method());
        }
        if (filter instanceof UserSearchFilter.NickName) {
            UserSearchFilter.NickName q = (UserSearchFilter.NickName) filter;
            return text(UserColumn.NICK_NAME, q.nickName(), q.method());
        }
        if (filter instanceof UserSearchFilter.DisplayName) {
            UserSearchFilter.DisplayName q = (UserSearchFilter.DisplayName) filter;
            return text(UserColumn.DISPLAY_NAME, q.displayName(), q.method());
        }
        if (filter instanceof UserSearchFilter.Email) {
            UserSearchFilter.Email q = (UserSearchFilter.Email) filter;
            return text(UserColumn.EMAIL, q.emailAddress(), q.method());
        }
        if (filter instanceof UserSearchFilter.State) {
            UserSearchFilter.State q = (UserSearchFilter.State) filter;
            return new TextQuery(UserColumn.STATE, q.state() == null ? null : q.state().name(), TextComparison.EQUALS);
        }
        if (filter instanceof UserSearchFilter.Type) {
            UserSearchFilter.Type q = (UserSearchFilter.Type) filter;
            return new TextQuery(UserColumn.TYPE, q.type() == null ? null : q.type().name(), TextComparison.EQUALS);
        }
        if (filter instanceof UserSearchFilter.LoginName) {
            UserSearchFilter.LoginName q = (UserSearchFilter.LoginName) filter;
            return text(UserColumn.LOGIN_NAME, q.loginName(), q.method());
        }
        if (filter instanceof UserSearchFilter.ResourceOwner) {
            UserSearchFilter.ResourceOwner q = (UserSearchFilter.ResourceOwner) filter;
            return new TextQuery(UserColumn.RESOURCE_OWNER, q.orgId(), TextComparison.EQUALS);
        }
        if (filter instanceof UserSearchFilter.InUserIds) {
            return new InListQuery(UserColumn.ID, ((UserSearchFilter.InUserIds) filter).userIds());
        }
        if (filter instanceof UserSearchFilter.Or) {
            return new OrQuery(toQueries(((UserSearchFilter.Or) filter).queries(), level + 1));
        }
        if (filter instanceof UserSearchFilter.And) {
            return new AndQuery(toQueries(((UserSearchFilter.And) filter).queries(), level + 1));
        }
        if (filter instanceof UserSearchFilter.Not) {
            return new NotQuery(toQuery(((UserSearchFilter.Not) filter).query(), level + 1));
        }
        throw new InvalidArgumentException("GRPC-vR9nC", "List.Query.Invalid");
    }

    private static SearchQuery text(UserColumn column, String value, TextMethod method) {
        return new TextQuery(column, value, TextMethod.toComparison(method));
    }
}
