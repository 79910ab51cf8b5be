package com.identity.engine.query;

import com.identity.core.exception.InternalException;
import com.identity.core.exception.NotFoundException;
import com.identity.core.projection.User;
import com.identity.core.query.SearchQuery;
import com.identity.core.repository.UserProjectionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of the user projection.
 * For tests and local setups.
 */
public class InMemoryUserProjectionRepository implements UserProjectionRepository, UserProjectionWriter {

    private final Map<String, User> users = new ConcurrentHashMap<>();

    @Override
    public User getById(String tenantId, String userId) {
        return find(tenantId, userId)
            .orElseThrow(() -> new NotFoundException("QUERY-Dfbg2", "Errors.User.NotFound"));
    }

    @Override
    public User getOne(String tenantId, SearchQuery query) {
        List<User> matches = search(tenantId, query);
        if (matches.isEmpty()) {
            throw new NotFoundException("QUERY-Dfbg3", "Errors.User.NotFound");
        }
        if (matches.size() > 1) {
            throw new InternalException("DATAB-Ohm4e", "Errors.Query.TooManyResults");
        }
        return matches.get(0);
    }

    @Override
    public List<User> search(String tenantId, SearchQuery query) {
        return users.values().stream()
            .filter(user -> user.tenantId().equals(tenantId))
            .filter(query::matches)
            .sorted(Comparator.comparing(User::id))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<User> find(String tenantId, String userId) {
        return Optional.ofNullable(users.get(key(tenantId, userId)));
    }

    @Override
    public void save(User user) {
        users.put(key(user.tenantId(), user.id()), user);
    }

    @Override
    public void delete(String tenantId, String userId) {
        users.remove(key(tenantId, userId));
    }

    private static String key(String tenantId, String userId) {
        return tenantId + "/" + userId;
    }
}
