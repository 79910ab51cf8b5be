package com.identity.api.oidc;

import com.identity.core.crypto.BCryptPasswordHasher;
import com.identity.core.crypto.HashVerificationException;
import com.identity.core.crypto.SecretGenerator;
import com.identity.core.exception.InternalException;
import com.identity.core.exception.InvalidArgumentException;
import com.identity.core.exception.NotFoundException;
import com.identity.core.exception.PreconditionFailedException;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventType;
import com.identity.core.projection.AccessTokenType;
import com.identity.core.query.SearchQuery;
import com.identity.core.repository.UserProjectionRepository;
import com.identity.engine.command.AddMachine;
import com.identity.engine.command.CommandExecutor;
import com.identity.engine.command.MachineSecret;
import com.identity.engine.command.UserCommands;
import com.identity.engine.dispatch.EventDispatcher;
import com.identity.engine.metrics.EventStoreMetrics;
import com.identity.engine.persistence.InMemoryEventStore;
import com.identity.engine.query.InMemoryUserProjectionRepository;
import com.identity.engine.query.UserProjector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientCredentialsAuthenticatorTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private EventDispatcher dispatcher;

    private InMemoryEventStore eventStore;
    private InMemoryUserProjectionRepository users;
    private UserProjector projector;
    private UserCommands commands;
    private BCryptPasswordHasher hasher;
    private ClientCredentialsAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore(Duration.ofSeconds(5), new EventStoreMetrics());
        users = new InMemoryUserProjectionRepository();
        projector = new UserProjector(users);
        hasher = new BCryptPasswordHasher(4);
        commands = new UserCommands(new CommandExecutor(eventStore), dispatcher, hasher, new SecretGenerator(32));
        authenticator = new ClientCredentialsAuthenticator(users, commands, hasher);
    }

    @Test
    @DisplayName("Valid credentials should yield a client-credentials-only client and a success audit event")
    void authenticate_shouldSucceedWithValidSecret() {
        MachineSecret secret = machineWithSecret("user-1", "svc", AccessTokenType.JWT);

        ClientCredentialsClient client = authenticator.authenticate(TENANT, "svc", secret.clientSecret());

        assertThat(client.getId()).isEqualTo("svc");
        assertThat(client.getUser().id()).isEqualTo("user-1");
        assertThat(client.grantTypes()).containsExactly(GrantType.CLIENT_CREDENTIALS);
        assertThat(client.accessTokenType()).isEqualTo(AccessTokenType.JWT);
        assertThat(client.applicationType()).isEqualTo(OidcClientDescriptor.ApplicationType.WEB);
        assertThat(client.authMethod()).isEqualTo(OidcClientDescriptor.AuthMethod.BASIC);
        assertThat(client.redirectUris()).isEmpty();
        assertThat(client.idTokenLifetime()).isZero();
        assertThat(client.clockSkew()).isZero();
        assertThat(client.devMode()).isFalse();
        assertThat(client.isScopeAllowed("openid")).isFalse();
        assertThat(client.restrictAdditionalAccessTokenScopes().apply(List.of("a", "b"))).containsExactly("a", "b");

        assertThat(dispatchedTypes()).containsExactly(EventType.USER_MACHINE_SECRET_CHECK_SUCCEEDED);
    }

    @Test
    void authenticate_shouldDefaultToBearerTokens() {
        MachineSecret secret = machineWithSecret("user-1", "svc", null);

        assertThat(authenticator.authenticate(TENANT, "svc", secret.clientSecret()).accessTokenType())
            .isEqualTo(AccessTokenType.BEARER);
    }

    @Test
    @DisplayName("An unknown client id should be reported as invalid_client")
    void authenticate_shouldRejectUnknownClient() {
        assertThatThrownBy(() -> authenticator.authenticate(TENANT, "nobody", "secret"))
            .isInstanceOf(OidcException.class)
            .satisfies(e -> {
                OidcException oidc = (OidcException) e;
                assertThat(oidc.getError()).isEqualTo(OidcError.INVALID_CLIENT);
                assertThat(oidc.getDescription()).isEqualTo("client not found");
            })
            .hasCauseInstanceOf(NotFoundException.class);
        verify(dispatcher, never()).dispatch(anyString(), any(EventCommand[].class));
    }

    @Test
    void authenticate_shouldRequireAMachineSecret() {
        commands.addMachine(TENANT, new AddMachine("user-1", "org-1", "svc", "Service", null, null), "admin");
        projector.catchUp(eventStore, TENANT, "user-1");

        assertThatThrownBy(() -> authenticator.authenticate(TENANT, "svc", "secret"))
            .isInstanceOf(PreconditionFailedException.class)
            .hasMessageContaining("OIDC-pieP8");
    }

    @Test
    @DisplayName("A wrong secret should be rejected and leave a failure audit event")
    void authenticate_shouldRejectWrongSecret() {
        machineWithSecret("user-1", "svc", null);

        assertThatThrownBy(() -> authenticator.authenticate(TENANT, "svc", "wrong-secret"))
            .isInstanceOf(InvalidArgumentException.class)
            .hasMessageContaining("Errors.User.Machine.Secret.Invalid")
            .hasCauseInstanceOf(HashVerificationException.class);

        ArgumentCaptor<EventCommand> captor = ArgumentCaptor.forClass(EventCommand.class);
        verify(dispatcher).dispatch(eq(TENANT), captor.capture());
        assertThat(captor.getValue().eventType()).isEqualTo(EventType.USER_MACHINE_SECRET_CHECK_FAILED);
        assertThat(captor.getValue().aggregateId()).isEqualTo("user-1");
        assertThat(captor.getValue().resourceOwner()).isEqualTo("org-1");
    }

    @Test
    void authenticate_shouldPropagateOtherLookupErrors() {
        UserProjectionRepository failing = mock(UserProjectionRepository.class);
        when(failing.getOne(eq(TENANT), any(SearchQuery.class)))
            .thenThrow(new InternalException("DATAB-Oath6", "Errors.Internal"));
        ClientCredentialsAuthenticator broken = new ClientCredentialsAuthenticator(failing, commands, hasher);

        assertThatThrownBy(() -> broken.authenticate(TENANT, "svc", "secret"))
            .isInstanceOf(InternalException.class);
    }

    @Test
    void tokenRequest_shouldTargetTheClient() {
        MachineSecret secret = machineWithSecret("user-1", "svc", null);
        ClientCredentialsClient client = authenticator.authenticate(TENANT, "svc", secret.clientSecret());

        ClientCredentialsRequest request = authenticator.tokenRequest(client, List.of("profile"));

        assertThat(request.subject()).isEqualTo("user-1");
        assertThat(request.audience()).containsExactly("svc");
        assertThat(request.scopes()).containsExactly("profile");
    }

    // ========== Helpers ==========

    private MachineSecret machineWithSecret(String userId, String userName, AccessTokenType tokenType) {
        commands.addMachine(TENANT, new AddMachine(userId, "org-1", userName, "Service", null, tokenType), "admin");
        MachineSecret secret = commands.generateMachineSecret(TENANT, userId, "admin");
        projector.catchUp(eventStore, TENANT, userId);
        return secret;
    }

    private List<EventType> dispatchedTypes() {
        ArgumentCaptor<EventCommand> captor = ArgumentCaptor.forClass(EventCommand.class);
        verify(dispatcher, atLeastOnce()).dispatch(eq(TENANT), captor.capture());
        return captor.getAllValues().stream().map(EventCommand::eventType).toList();
    }
}
