package com.identity.engine.query;

import com.identity.core.exception.NotFoundException;
import com.identity.core.projection.OidcClient;
import com.identity.core.repository.OidcClientRepository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of OidcClientRepository.
 * For tests and local setups.
 */
public class InMemoryOidcClientRepository implements OidcClientRepository {

    private final Map<String, OidcClient> clients = new ConcurrentHashMap<>();

    @Override
    public OidcClient getByClientId(String tenantId, String clientId) {
        OidcClient client = clients.get(tenantId + "/" + clientId);
        if (client == null) {
            throw new NotFoundException("QUERY-wu6Ee", "Errors.App.NotFound");
        }
        return client;
    }

    public void save(OidcClient client) {
        clients.put(client.tenantId() + "/" + client.clientId(), client);
    }
}
