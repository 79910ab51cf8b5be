package com.identity.engine.command;

import com.identity.core.crypto.PasswordHasher;
import com.identity.core.crypto.SecretGenerator;
import com.identity.core.exception.AlreadyExistsException;
import com.identity.core.exception.InvalidArgumentException;
import com.identity.core.exception.NotFoundException;
import com.identity.core.exception.PreconditionFailedException;
import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventPayload;
import com.identity.core.model.EventType;
import com.identity.core.model.user.MachineAddedPayload;
import com.identity.core.model.user.MachineChangedPayload;
import com.identity.core.model.user.MachineSecretSetPayload;
import com.identity.core.model.user.UserNameReservedPayload;
import com.identity.core.projection.AccessTokenType;
import com.identity.core.projection.UserState;
import com.identity.engine.dispatch.EventDispatcher;
import com.identity.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Commands on machine users.
 *
 * Every command reduces the user's write-model, validates against it and appends with the
 * reduced sequence as expected sequence. Secret check results are side effects and go through
 * the dispatcher.
 */
public class UserCommands {

    private static final Logger log = LoggerFactory.getLogger(UserCommands.class);

    private final CommandExecutor executor;
    private final EventDispatcher dispatcher;
    private final PasswordHasher passwordHasher;
    private final SecretGenerator secretGenerator;

    public UserCommands(
            CommandExecutor executor,
            EventDispatcher dispatcher,
            PasswordHasher passwordHasher,
            SecretGenerator secretGenerator) {
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.passwordHasher = passwordHasher;
        this.secretGenerator = secretGenerator;
    }

    // ========== Lifecycle ==========

    public ObjectDetails addMachine(String tenantId, AddMachine machine, String actorId) {
        if (isBlank(machine.userId()) || isBlank(machine.resourceOwner())) {
            throw new InvalidArgumentException("COMMAND-xiown2", "Errors.IDMissing");
        }
        if (isBlank(machine.userName())) {
            throw new InvalidArgumentException("COMMAND-bm9Ds", "Errors.User.Username.Empty");
        }
        if (isBlank(machine.name())) {
            throw new InvalidArgumentException("COMMAND-NDx3b", "Errors.User.Machine.Name.Empty");
        }

        try (var ctx = LoggingContext.forAggregate(tenantId, AggregateType.USER.value(), machine.userId())) {
            UserExistsWriteModel existence = new UserExistsWriteModel(tenantId, machine.userId());
            UserNameWriteModel userName = new UserNameWriteModel(tenantId, machine.userName());
            AccessTokenType tokenType = machine.accessTokenType() == null
                ? AccessTokenType.BEARER : machine.accessTokenType();

            // the user event goes last so the returned details describe the user
            List<Event> events = executor.execute(tenantId,
                List.of(
                    Precondition.notExists(existence,
                        () -> new AlreadyExistsException("COMMAND-k2LmS", "Errors.User.AlreadyExisting")),
                    Precondition.notExists(userName,
                        () -> new AlreadyExistsException("COMMAND-Uq4nM", "Errors.User.AlreadyExists"))),
                () -> List.of(
                    EventCommand.forUserName(
                        machine.userName(), machine.resourceOwner(), EventType.USER_NAME_RESERVED,
                        new UserNameReservedPayload(machine.userId()), actorId, userName.getProcessedSequence()),
                    EventCommand.forUser(
                        machine.userId(), machine.resourceOwner(), EventType.USER_MACHINE_ADDED,
                        new MachineAddedPayload(machine.userName(), machine.name(), machine.description(), tokenType),
                        actorId, existence.getProcessedSequence())));

            log.info("Added machine user {}", machine.userName());
            return ObjectDetails.fromEvents(events);
        }
    }

    /**
     * Change name, description or token type. Only fields that differ from the current state are recorded.
     */
    public ObjectDetails changeMachine(String tenantId, String userId, MachineChangedPayload change, String actorId) {
        if (change.name() != null && change.name().isBlank()) {
            throw new InvalidArgumentException("COMMAND-NDx3c", "Errors.User.Machine.Name.Empty");
        }
        MachineUserWriteModel model = existingMachine(tenantId, userId);

        MachineChangedPayload diff = new MachineChangedPayload(
            Objects.equals(change.name(), model.getName()) ? null : change.name(),
            Objects.equals(change.description(), model.getDescription()) ? null : change.description(),
            change.accessTokenType() == model.getAccessTokenType() ? null : change.accessTokenType());
        if (!diff.hasChanges()) {
            throw new PreconditionFailedException("COMMAND-2n8vs", "Errors.User.NotChanged");
        }

        return push(model, EventType.USER_MACHINE_CHANGED, diff, actorId);
    }

    public ObjectDetails deactivateUser(String tenantId, String userId, String actorId) {
        MachineUserWriteModel model = existingMachine(tenantId, userId);
        if (model.getState() == UserState.INACTIVE) {
            throw new PreconditionFailedException("COMMAND-5M0sf", "Errors.User.AlreadyInactive");
        }
        return push(model, EventType.USER_DEACTIVATED, null, actorId);
    }

    public ObjectDetails reactivateUser(String tenantId, String userId, String actorId) {
        MachineUserWriteModel model = existingMachine(tenantId, userId);
        if (model.getState() != UserState.INACTIVE) {
            throw new PreconditionFailedException("COMMAND-6M0sf", "Errors.User.NotInactive");
        }
        return push(model, EventType.USER_REACTIVATED, null, actorId);
    }

    /**
     * Remove the user and release its user name for reuse.
     */
    public ObjectDetails removeUser(String tenantId, String userId, String actorId) {
        MachineUserWriteModel model = existingMachine(tenantId, userId);
        UserNameWriteModel userName = new UserNameWriteModel(tenantId, model.getUserName());
        executor.reduce(userName);

        ObjectDetails details;
        if (userId.equals(userName.getUserId())) {
            details = push(model, EventType.USER_REMOVED, null, actorId, EventCommand.forUserName(
                model.getUserName(), model.getResourceOwner(), EventType.USER_NAME_RELEASED, null,
                actorId, userName.getProcessedSequence()));
        } else {
            log.warn("User {} does not hold user name {}, nothing to release", userId, model.getUserName());
            details = push(model, EventType.USER_REMOVED, null, actorId);
        }
        log.info("Removed user {}", userId);
        return details;
    }

    // ========== Secrets ==========

    public ObjectDetails setMachineSecret(String tenantId, String userId, String clientSecret, String actorId) {
        if (isBlank(clientSecret)) {
            throw new InvalidArgumentException("COMMAND-Dgb4s", "Errors.User.Machine.Secret.Empty");
        }
        MachineUserWriteModel model = existingMachine(tenantId, userId);
        return push(model, EventType.USER_MACHINE_SECRET_SET,
            new MachineSecretSetPayload(passwordHasher.hash(clientSecret)), actorId);
    }

    /**
     * Generate and set a new secret. The returned plaintext is not stored anywhere.
     */
    public MachineSecret generateMachineSecret(String tenantId, String userId, String actorId) {
        MachineUserWriteModel model = existingMachine(tenantId, userId);
        String secret = secretGenerator.generate();
        ObjectDetails details = push(model, EventType.USER_MACHINE_SECRET_SET,
            new MachineSecretSetPayload(passwordHasher.hash(secret)), actorId);
        return new MachineSecret(model.getUserName(), secret, details);
    }

    public ObjectDetails removeMachineSecret(String tenantId, String userId, String actorId) {
        MachineUserWriteModel model = existingMachine(tenantId, userId);
        if (!model.hasSecret()) {
            throw new PreconditionFailedException("COMMAND-x0992", "Errors.User.Machine.Secret.NotExisting");
        }
        return push(model, EventType.USER_MACHINE_SECRET_REMOVED, null, actorId);
    }

    /**
     * Record a successful secret check. Best effort, returns immediately.
     */
    public void machineSecretCheckSucceeded(String tenantId, String userId, String resourceOwner) {
        dispatcher.dispatch(tenantId, EventCommand.forUser(userId, resourceOwner,
            EventType.USER_MACHINE_SECRET_CHECK_SUCCEEDED, null, Event.ACTOR_SYSTEM, EventCommand.ANY_SEQUENCE));
    }

    /**
     * Record a failed secret check. Best effort, returns immediately.
     */
    public void machineSecretCheckFailed(String tenantId, String userId, String resourceOwner) {
        dispatcher.dispatch(tenantId, EventCommand.forUser(userId, resourceOwner,
            EventType.USER_MACHINE_SECRET_CHECK_FAILED, null, Event.ACTOR_SYSTEM, EventCommand.ANY_SEQUENCE));
    }

    // ========== Internal Methods ==========

    private MachineUserWriteModel existingMachine(String tenantId, String userId) {
        if (isBlank(userId)) {
            throw new InvalidArgumentException("COMMAND-0Mx9s", "Errors.IDMissing");
        }
        MachineUserWriteModel model = new MachineUserWriteModel(tenantId, userId);
        executor.reduce(model);
        if (!model.exists()) {
            throw new NotFoundException("COMMAND-5M0od", "Errors.User.NotFound");
        }
        return model;
    }

    /**
     * Append one user event, plus related commands on other aggregates in the same atomic call.
     */
    private ObjectDetails push(MachineUserWriteModel model, EventType type,
                               EventPayload payload, String actorId, EventCommand... related) {
        try (var ctx = LoggingContext.forAggregate(
                model.getTenantId(), AggregateType.USER.value(), model.getAggregateId())) {
            List<EventCommand> commands = new ArrayList<>(related.length + 1);
            commands.add(EventCommand.forUser(model.getAggregateId(), model.getResourceOwner(),
                type, payload, actorId, model.getProcessedSequence()));
            commands.addAll(Arrays.asList(related));
            executor.pushAppendAndReduce(model.getTenantId(), model, commands);
            log.debug("Applied {} (sequence {})", type.value(), model.getProcessedSequence());
            return ObjectDetails.fromWriteModel(model);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
