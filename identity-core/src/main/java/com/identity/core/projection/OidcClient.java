package com.identity.core.projection;

import java.time.Duration;
import java.util.List;

/**
 * OIDC configuration of an application.
 */
public record OidcClient(
    String appId,
    String tenantId,
    String projectId,
    String clientId,
    AppState state,
    String clientSecretHash,
    List<String> redirectUris,
    List<String> postLogoutRedirectUris,
    List<String> responseTypes,
    List<String> grantTypes,
    String applicationType,
    String authMethodType,
    AccessTokenType accessTokenType,
    boolean accessTokenRoleAssertion,
    boolean idTokenRoleAssertion,
    boolean idTokenUserinfoAssertion,
    Duration clockSkew,
    boolean devMode,
    List<String> additionalOrigins,
    boolean projectRoleAssertion
) {
    public OidcClient {
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
        postLogoutRedirectUris = postLogoutRedirectUris == null ? List.of() : List.copyOf(postLogoutRedirectUris);
        responseTypes = responseTypes == null ? List.of() : List.copyOf(responseTypes);
        grantTypes = grantTypes == null ? List.of() : List.copyOf(grantTypes);
        additionalOrigins = additionalOrigins == null ? List.of() : List.copyOf(additionalOrigins);
        clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
    }

    public enum AppState {
        UNSPECIFIED,
        ACTIVE,
        INACTIVE,
        REMOVED
    }
}
