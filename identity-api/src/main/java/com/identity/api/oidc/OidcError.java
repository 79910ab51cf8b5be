package com.identity.api.oidc;

/**
 * OAuth 2.0 / OIDC error codes returned to clients.
 */
public enum OidcError {
    INVALID_REQUEST("invalid_request"),
    INVALID_CLIENT("invalid_client"),
    INVALID_GRANT("invalid_grant"),
    UNAUTHORIZED_CLIENT("unauthorized_client"),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type"),
    INVALID_SCOPE("invalid_scope"),
    SERVER_ERROR("server_error");

    private final String code;

    OidcError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
