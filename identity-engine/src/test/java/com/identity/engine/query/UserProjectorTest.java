package com.identity.engine.query;

import com.identity.core.crypto.BCryptPasswordHasher;
import com.identity.core.crypto.SecretGenerator;
import com.identity.core.exception.NotFoundException;
import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventFilter;
import com.identity.core.model.EventType;
import com.identity.core.model.user.MachineChangedPayload;
import com.identity.core.projection.AccessTokenType;
import com.identity.core.projection.User;
import com.identity.core.projection.UserState;
import com.identity.core.projection.UserType;
import com.identity.core.query.TextComparison;
import com.identity.core.query.TextQuery;
import com.identity.core.query.UserColumn;
import com.identity.engine.command.AddMachine;
import com.identity.engine.command.CommandExecutor;
import com.identity.engine.command.UserCommands;
import com.identity.engine.metrics.EventStoreMetrics;
import com.identity.engine.persistence.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserProjectorTest {

    private static final String TENANT = "tenant-1";

    private InMemoryEventStore eventStore;
    private UserCommands commands;
    private InMemoryUserProjectionRepository repository;
    private UserProjector projector;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore(Duration.ofSeconds(5), new EventStoreMetrics());
        commands = new UserCommands(new CommandExecutor(eventStore), (tenantId, events) -> { },
            new BCryptPasswordHasher(4), new SecretGenerator(16));
        repository = new InMemoryUserProjectionRepository();
        projector = new UserProjector(repository);
    }

    @Test
    void catchUp_shouldProjectMachineUser() {
        commands.addMachine(TENANT, new AddMachine("user-1", "org-1", "svc", "Service", "desc", null), "admin");
        commands.setMachineSecret(TENANT, "user-1", "secret-value", "admin");

        projector.catchUp(eventStore, TENANT, "user-1");

        User user = repository.getById(TENANT, "user-1");
        assertThat(user.type()).isEqualTo(UserType.MACHINE);
        assertThat(user.state()).isEqualTo(UserState.ACTIVE);
        assertThat(user.loginNames()).containsExactly("svc");
        assertThat(user.preferredLoginName()).isEqualTo("svc");
        assertThat(user.machine().accessTokenType()).isEqualTo(AccessTokenType.BEARER);
        assertThat(user.machine().hasSecret()).isTrue();
        assertThat(user.sequence()).isEqualTo(2);
        assertThat(repository.getOne(TENANT, new TextQuery(UserColumn.LOGIN_NAME, "svc", TextComparison.EQUALS)))
            .isEqualTo(user);
    }

    @Test
    void catchUp_shouldApplyOnlyNewEvents() {
        commands.addMachine(TENANT, new AddMachine("user-1", "org-1", "svc", "Service", null, null), "admin");
        projector.catchUp(eventStore, TENANT, "user-1");

        commands.changeMachine(TENANT, "user-1", new MachineChangedPayload("Renamed", null, AccessTokenType.JWT), "admin");
        commands.deactivateUser(TENANT, "user-1", "admin");
        projector.catchUp(eventStore, TENANT, "user-1");

        User user = repository.getById(TENANT, "user-1");
        assertThat(user.machine().name()).isEqualTo("Renamed");
        assertThat(user.machine().accessTokenType()).isEqualTo(AccessTokenType.JWT);
        assertThat(user.state()).isEqualTo(UserState.INACTIVE);
        assertThat(user.sequence()).isEqualTo(3);
    }

    @Test
    void handle_shouldIgnoreReplayedEvents() {
        commands.addMachine(TENANT, new AddMachine("user-1", "org-1", "svc", "Service", null, null), "admin");
        commands.deactivateUser(TENANT, "user-1", "admin");
        List<Event> events = eventStore.query(EventFilter.forAggregate(TENANT, AggregateType.USER, "user-1"));

        events.forEach(projector::handle);
        projector.handle(events.get(0));

        assertThat(repository.getById(TENANT, "user-1").state()).isEqualTo(UserState.INACTIVE);
    }

    @Test
    void handle_shouldSkipSecretCheckObservations() {
        commands.addMachine(TENANT, new AddMachine("user-1", "org-1", "svc", "Service", null, null), "admin");
        eventStore.append(TENANT, List.of(EventCommand.forUser("user-1", "org-1",
            EventType.USER_MACHINE_SECRET_CHECK_SUCCEEDED, null, Event.ACTOR_SYSTEM, EventCommand.ANY_SEQUENCE)));

        projector.catchUp(eventStore, TENANT, "user-1");

        assertThat(repository.getById(TENANT, "user-1").sequence()).isEqualTo(1);
    }

    @Test
    void removedUser_shouldDisappearFromProjection() {
        commands.addMachine(TENANT, new AddMachine("user-1", "org-1", "svc", "Service", null, null), "admin");
        commands.removeUser(TENANT, "user-1", "admin");

        projector.catchUp(eventStore, TENANT, "user-1");

        assertThatThrownBy(() -> repository.getById(TENANT, "user-1")).isInstanceOf(NotFoundException.class);
    }
}
