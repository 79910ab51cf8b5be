package com.identity.core.repository;

import com.identity.core.projection.User;
import com.identity.core.query.SearchQuery;
import java.util.List;

/**
 * Read access to the user projection.
 */
public interface UserProjectionRepository {

    /**
     * @throws com.identity.core.exception.NotFoundException if no user has the id
     * @throws com.identity.core.exception.InternalException if the row cannot be decoded or read
     */
    User getById(String tenantId, String userId);

    /**
     * Get the single user matching the query.
     *
     * @throws com.identity.core.exception.NotFoundException if no user matches
     * @throws com.identity.core.exception.InternalException if more than one user matches
     */
    User getOne(String tenantId, SearchQuery query);

    /**
     * Get all users matching the query, ordered by id.
     */
    List<User> search(String tenantId, SearchQuery query);
}
