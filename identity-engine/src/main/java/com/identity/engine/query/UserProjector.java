package com.identity.engine.query;

import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventFilter;
import com.identity.core.model.user.MachineAddedPayload;
import com.identity.core.model.user.MachineChangedPayload;
import com.identity.core.model.user.MachineSecretSetPayload;
import com.identity.core.projection.AccessTokenType;
import com.identity.core.projection.Machine;
import com.identity.core.projection.User;
import com.identity.core.projection.UserState;
import com.identity.core.projection.UserType;
import com.identity.core.repository.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Folds user events into the user projection.
 *
 * Events at or below the projected sequence are ignored, so replaying a stream is harmless.
 * Machine users get their user name as their only login name.
 */
public class UserProjector {

    private static final Logger log = LoggerFactory.getLogger(UserProjector.class);

    private final UserProjectionWriter writer;

    public UserProjector(UserProjectionWriter writer) {
        this.writer = writer;
    }

    /**
     * Bring one user's projection up to date with the event store.
     */
    public void catchUp(EventStore eventStore, String tenantId, String userId) {
        long projected = writer.find(tenantId, userId).map(User::sequence).orElse(0L);
        EventFilter filter = EventFilter.forAggregate(tenantId, AggregateType.USER, userId).after(projected);
        List<Event> events = eventStore.query(filter);
        events.forEach(this::handle);
    }

    public void handle(Event event) {
        if (event.aggregateType() != AggregateType.USER || event.eventType().isObservation()) {
            return;
        }
        Optional<User> current = writer.find(event.tenantId(), event.aggregateId());
        if (current.isPresent() && event.sequence() <= current.get().sequence()) {
            log.debug("Skipping already projected event {} of user {}", event.sequence(), event.aggregateId());
            return;
        }

        switch (event.eventType()) {
            case USER_MACHINE_ADDED -> writer.save(added(event));
            case USER_REMOVED -> writer.delete(event.tenantId(), event.aggregateId());
            default -> {
                if (current.isEmpty()) {
                    log.warn("Event {} for unknown user {}, skipping", event.eventType().value(), event.aggregateId());
                    return;
                }
                writer.save(changed(current.get(), event));
            }
        }
    }

    // ========== Internal Methods ==========

    private static User added(Event event) {
        MachineAddedPayload payload = event.payloadAs(MachineAddedPayload.class);
        AccessTokenType tokenType = payload.accessTokenType() == null ? AccessTokenType.BEARER : payload.accessTokenType();
        return new User(
            event.aggregateId(),
            event.tenantId(),
            event.resourceOwner(),
            UserState.ACTIVE,
            UserType.MACHINE,
            payload.userName(),
            List.of(payload.userName()),
            payload.userName(),
            null,
            new Machine(payload.name(), payload.description(), null, tokenType),
            event.sequence(),
            event.timestamp());
    }

    private static User changed(User user, Event event) {
        Machine machine = user.machine();
        return switch (event.eventType()) {
            case USER_MACHINE_CHANGED -> {
                MachineChangedPayload change = event.payloadAs(MachineChangedPayload.class);
                Machine updated = new Machine(
                    change.name() != null ? change.name() : machine.name(),
                    change.description() != null ? change.description() : machine.description(),
                    machine.secretHash(),
                    change.accessTokenType() != null ? change.accessTokenType() : machine.accessTokenType());
                yield user.withMachine(updated, event.sequence(), event.timestamp());
            }
            case USER_MACHINE_SECRET_SET -> user.withMachine(
                new Machine(machine.name(), machine.description(),
                    event.payloadAs(MachineSecretSetPayload.class).secretHash(), machine.accessTokenType()),
                event.sequence(), event.timestamp());
            case USER_MACHINE_SECRET_REMOVED -> user.withMachine(
                new Machine(machine.name(), machine.description(), null, machine.accessTokenType()),
                event.sequence(), event.timestamp());
            case USER_DEACTIVATED -> user.withState(UserState.INACTIVE, event.sequence(), event.timestamp());
            case USER_REACTIVATED -> user.withState(UserState.ACTIVE, event.sequence(), event.timestamp());
            default -> throw new IllegalStateException("Unexpected user event " + event.eventType().value());
        };
    }
}
