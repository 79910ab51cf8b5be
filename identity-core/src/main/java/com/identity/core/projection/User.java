package com.identity.core.projection;

import com.identity.core.query.Column;
import com.identity.core.query.SearchableRecord;
import com.identity.core.query.UserColumn;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Read-optimized view of a user.
 * Exactly one of {@code human} and {@code machine} is set, according to {@code type}.
 */
public record User(
    String id,
    String tenantId,
    String resourceOwner,
    UserState state,
    UserType type,
    String userName,
    List<String> loginNames,
    String preferredLoginName,
    Human human,
    Machine machine,
    long sequence,
    Instant changeDate
) implements SearchableRecord {

    public User {
        loginNames = loginNames == null ? List.of() : List.copyOf(loginNames);
    }

    @Override
    public Collection<String> values(Column column) {
        if (!(column instanceof UserColumn)) {
            return List.of();
        }
        List<String> values = new ArrayList<>(1);
        switch ((UserColumn) column) {
            case ID -> values.add(id);
            case USER_NAME -> values.add(userName);
            case FIRST_NAME -> values.add(human == null ? null : human.firstName());
            case LAST_NAME -> values.add(human == null ? null : human.lastName());
            case NICK_NAME -> values.add(human == null ? null : human.nickName());
            case DISPLAY_NAME -> values.add(human == null ? null : human.displayName());
            case EMAIL -> values.add(human == null ? null : human.email());
            case STATE -> values.add(state == null ? null : state.name());
            case TYPE -> values.add(type == null ? null : type.name());
            case RESOURCE_OWNER -> values.add(resourceOwner);
            case LOGIN_NAME -> values.addAll(loginNames);
        }
        values.removeIf(value -> value == null);
        return values;
    }

    /**
     * Copy with a new machine part and the sequence/date of the event that changed it.
     */
    public User withMachine(Machine machine, long sequence, Instant changeDate) {
        return new User(id, tenantId, resourceOwner, state, type, userName, loginNames, preferredLoginName,
            human, machine, sequence, changeDate);
    }

    public User withState(UserState state, long sequence, Instant changeDate) {
        return new User(id, tenantId, resourceOwner, state, type, userName, loginNames, preferredLoginName,
            human, machine, sequence, changeDate);
    }

    public boolean machineUser() {
        return type == UserType.MACHINE && machine != null;
    }
}
