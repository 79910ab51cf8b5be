package com.identity.engine.query.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.core.exception.InternalException;
import com.identity.core.exception.NotFoundException;
import com.identity.core.projection.OidcClient;
import com.identity.core.repository.OidcClientRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Optional;

/**
 * SQL-backed OIDC application lookup.
 */
public class JdbcOidcClientRepository implements OidcClientRepository {

    private static final String SELECT_BY_CLIENT_ID = """
        SELECT data FROM projections.oidc_clients
        WHERE tenant_id = ? AND client_id = ?
        """;

    private final JsonObjectQuery jsonQuery;

    public JdbcOidcClientRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jsonQuery = new JsonObjectQuery(jdbcTemplate, objectMapper);
    }

    @Override
    public OidcClient getByClientId(String tenantId, String clientId) {
        Optional<OidcClient> client;
        try {
            client = jsonQuery.queryOne(SELECT_BY_CLIENT_ID, OidcClient.class, tenantId, clientId);
        } catch (InternalException e) {
            throw new InternalException("QUERY-ieR7R", "Errors.Internal", e);
        }
        return client.orElseThrow(() -> new NotFoundException("QUERY-wu6Ee", "Errors.App.NotFound"));
    }
}
