package com.identity.api.oidc;

import com.identity.core.crypto.HashVerificationException;
import com.identity.core.crypto.PasswordHasher;
import com.identity.core.exception.InvalidArgumentException;
import com.identity.core.exception.NotFoundException;
import com.identity.core.exception.PreconditionFailedException;
import com.identity.core.projection.User;
import com.identity.core.query.TextComparison;
import com.identity.core.query.TextQuery;
import com.identity.core.query.UserColumn;
import com.identity.core.repository.UserProjectionRepository;
import com.identity.engine.command.UserCommands;
import com.identity.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Authenticates machine users for the client credentials grant.
 *
 * The client id is a login name of the machine user. Every secret comparison leaves an audit
 * event, emitted asynchronously so authentication latency does not depend on the event store.
 */
public class ClientCredentialsAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsAuthenticator.class);

    private final UserProjectionRepository users;
    private final UserCommands commands;
    private final PasswordHasher passwordHasher;

    public ClientCredentialsAuthenticator(
            UserProjectionRepository users,
            UserCommands commands,
            PasswordHasher passwordHasher) {
        this.users = users;
        this.commands = commands;
        this.passwordHasher = passwordHasher;
    }

    /**
     * @throws OidcException with {@link OidcError#INVALID_CLIENT} if no user has the client id as login name
     * @throws PreconditionFailedException if the user has no machine secret
     * @throws InvalidArgumentException if the secret does not match
     */
    public ClientCredentialsClient authenticate(String tenantId, String clientId, String clientSecret) {
        try (var ctx = LoggingContext.forClient(tenantId, clientId)) {
            User user;
            try {
                user = users.getOne(tenantId, new TextQuery(UserColumn.LOGIN_NAME, clientId, TextComparison.EQUALS));
            } catch (NotFoundException e) {
                log.debug("No machine user for client id");
                throw new OidcException(OidcError.INVALID_CLIENT, "client not found", e);
            }

            if (user.machine() == null || !user.machine().hasSecret()) {
                throw new PreconditionFailedException("OIDC-pieP8", "Errors.User.Machine.Secret.NotExisting");
            }

            try {
                passwordHasher.verify(user.machine().secretHash(), clientSecret);
            } catch (HashVerificationException e) {
                commands.machineSecretCheckFailed(tenantId, user.id(), user.resourceOwner());
                log.info("Client secret check failed for user {}", user.id());
                throw new InvalidArgumentException("OIDC-VoXo6", "Errors.User.Machine.Secret.Invalid", e);
            }

            commands.machineSecretCheckSucceeded(tenantId, user.id(), user.resourceOwner());
            return new ClientCredentialsClient(clientId, user);
        }
    }

    /**
     * Build the token request for an authenticated client.
     */
    public ClientCredentialsRequest tokenRequest(ClientCredentialsClient client, List<String> scopes) {
        List<String> granted = client.restrictAdditionalAccessTokenScopes().apply(scopes);
        return new ClientCredentialsRequest(client.getUser().id(), List.of(client.getId()), granted);
    }
}
