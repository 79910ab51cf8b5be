package com.identity.api.oidc;

import java.util.List;

/**
 * Token request of the client credentials grant.
 *
 * @param subject id of the machine user the token is issued for
 */
public record ClientCredentialsRequest(String subject, List<String> audience, List<String> scopes) {

    public ClientCredentialsRequest {
        audience = audience == null ? List.of() : List.copyOf(audience);
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
