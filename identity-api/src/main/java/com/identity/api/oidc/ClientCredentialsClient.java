package com.identity.api.oidc;

import com.identity.core.projection.AccessTokenType;
import com.identity.core.projection.User;
import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A machine user acting as a confidential client in the client credentials grant.
 */
public class ClientCredentialsClient implements OidcClientDescriptor {

    private final String id;
    private final User user;

    public ClientCredentialsClient(String id, User user) {
        this.id = id;
        this.user = user;
    }

    /**
     * The client id the machine authenticated with, i.e. its user name.
     */
    @Override
    public String getId() {
        return id;
    }

    public User getUser() {
        return user;
    }

    @Override
    public List<String> redirectUris() {
        return List.of();
    }

    @Override
    public List<String> postLogoutRedirectUris() {
        return List.of();
    }

    @Override
    public ApplicationType applicationType() {
        return ApplicationType.WEB;
    }

    @Override
    public AuthMethod authMethod() {
        return AuthMethod.BASIC;
    }

    @Override
    public List<String> responseTypes() {
        return List.of();
    }

    @Override
    public List<GrantType> grantTypes() {
        return List.of(GrantType.CLIENT_CREDENTIALS);
    }

    @Override
    public String loginUrl(String authRequestId) {
        return "";
    }

    @Override
    public AccessTokenType accessTokenType() {
        if (user.machine() == null || user.machine().accessTokenType() == null) {
            return AccessTokenType.BEARER;
        }
        return user.machine().accessTokenType();
    }

    @Override
    public Duration idTokenLifetime() {
        return Duration.ZERO;
    }

    @Override
    public boolean devMode() {
        return false;
    }

    // no id_token is issued in this grant
    @Override
    public UnaryOperator<List<String>> restrictAdditionalIdTokenScopes() {
        return UnaryOperator.identity();
    }

    /**
     * All requested scopes pass through to the access token.
     */
    @Override
    public UnaryOperator<List<String>> restrictAdditionalAccessTokenScopes() {
        return UnaryOperator.identity();
    }

    // checked during auth request validation, which this grant has none of
    @Override
    public boolean isScopeAllowed(String scope) {
        return false;
    }

    @Override
    public boolean idTokenUserinfoClaimsAssertion() {
        return false;
    }

    @Override
    public Duration clockSkew() {
        return Duration.ZERO;
    }
}
