package com.identity.api.user;

import com.identity.core.projection.UserState;
import com.identity.core.projection.UserType;
import java.util.List;

/**
 * User filter as received from clients. Translated to internal predicates by {@link UserQueryTranslator}.
 */
public interface UserSearchFilter {

    record UserName(String userName, TextMethod method) implements UserSearchFilter {
    }

    record FirstName(String firstName, TextMethod method) implements UserSearchFilter {
    }

    record LastName(String lastName, TextMethod method) implements UserSearchFilter {
    }

    record NickName(String nickName, TextMethod method) implements UserSearchFilter {
    }

    record DisplayName(String displayName, TextMethod method) implements UserSearchFilter {
    }

    record Email(String emailAddress, TextMethod method) implements UserSearchFilter {
    }

    record State(UserState state) implements UserSearchFilter {
    }

    record Type(UserType type) implements UserSearchFilter {
    }

    record LoginName(String loginName, TextMethod method) implements UserSearchFilter {
    }

    /**
     * Always an exact match on the organization id.
     */
    record ResourceOwner(String orgId) implements UserSearchFilter {
    }

    record InUserIds(List<String> userIds) implements UserSearchFilter {
    }

    record Or(List<UserSearchFilter> queries) implements UserSearchFilter {
    }

    record And(List<UserSearchFilter> queries) implements UserSearchFilter {
    }

    record Not(UserSearchFilter query) implements UserSearchFilter {
    }
}
