package com.identity.core.repository;

import com.identity.core.projection.OidcClient;

/**
 * Read access to OIDC application configuration.
 */
public interface OidcClientRepository {

    /**
     * @throws com.identity.core.exception.NotFoundException if no application has the client id
     */
    OidcClient getByClientId(String tenantId, String clientId);
}
