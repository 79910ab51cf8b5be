package com.identity.api.oidc;

/**
 * Protocol-level error, rendered as an OAuth error response by the transport.
 */
public class OidcException extends RuntimeException {

    private final OidcError error;
    private final String description;

    public OidcException(OidcError error, String description, Throwable cause) {
        super(error.code() + ": " + description, cause);
        this.error = error;
        this.description = description;
    }

    public OidcError getError() {
        return error;
    }

    public String getDescription() {
        return description;
    }
}
