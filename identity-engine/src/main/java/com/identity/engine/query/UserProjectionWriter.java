package com.identity.engine.query;

import com.identity.core.projection.User;
import java.util.Optional;

/**
 * Write side of the user projection, used by {@link UserProjector}.
 */
public interface UserProjectionWriter {

    Optional<User> find(String tenantId, String userId);

    void save(User user);

    void delete(String tenantId, String userId);
}
