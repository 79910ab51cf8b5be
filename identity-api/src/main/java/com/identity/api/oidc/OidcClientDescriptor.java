package com.identity.api.oidc;

import com.identity.core.projection.AccessTokenType;
import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * What the token endpoint needs to know about an authenticated client.
 */
public interface OidcClientDescriptor {

    enum ApplicationType {
        WEB,
        USER_AGENT,
        NATIVE
    }

    enum AuthMethod {
        BASIC,
        POST,
        NONE,
        PRIVATE_KEY_JWT
    }

    String getId();

    List<String> redirectUris();

    List<String> postLogoutRedirectUris();

    ApplicationType applicationType();

    AuthMethod authMethod();

    List<String> responseTypes();

    List<GrantType> grantTypes();

    String loginUrl(String authRequestId);

    AccessTokenType accessTokenType();

    /**
     * Lifetime override for ID tokens, zero meaning the server default.
     */
    Duration idTokenLifetime();

    boolean devMode();

    UnaryOperator<List<String>> restrictAdditionalIdTokenScopes();

    UnaryOperator<List<String>> restrictAdditionalAccessTokenScopes();

    boolean isScopeAllowed(String scope);

    boolean idTokenUserinfoClaimsAssertion();

    Duration clockSkew();
}
