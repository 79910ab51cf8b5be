package com.identity.engine.persistence;

import com.identity.core.exception.ConcurrencyConflictException;
import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.ToLongFunction;

/**
 * Turns a batch of commands into events with contiguous per-stream sequences.
 * Shared by the in-memory and JDBC stores so both enforce the same checks.
 */
public final class AppendPlan {

    private final String tenantId;
    private final List<EventCommand> commands;
    private final SortedSet<StreamKey> streams = new TreeSet<>();

    public AppendPlan(String tenantId, List<EventCommand> commands) {
        this.tenantId = tenantId;
        this.commands = List.copyOf(commands);
        for (EventCommand command : this.commands) {
            streams.add(StreamKey.of(tenantId, command));
        }
    }

    /**
     * Streams touched by this batch, in lock order.
     */
    public SortedSet<StreamKey> streams() {
        return streams;
    }

    /**
     * Check expected sequences against the current stream heads and build the events.
     *
     * @param latestSequence current head of a stream, read under the caller's lock or transaction
     * @throws ConcurrencyConflictException if any stream is not at the sequence a command expects
     */
    public List<Event> toEvents(ToLongFunction<StreamKey> latestSequence) {
        Map<StreamKey, Long> heads = new HashMap<>();
        for (StreamKey stream : streams) {
            heads.put(stream, latestSequence.applyAsLong(stream));
        }

        for (EventCommand command : commands) {
            long head = heads.get(StreamKey.of(tenantId, command));
            if (command.checksSequence() && command.expectedSequence() != head) {
                throw new ConcurrencyConflictException(
                    "EVENT-Zx8pq", command.aggregateId(), command.expectedSequence(), head);
            }
        }

        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        List<Event> events = new ArrayList<>(commands.size());
        for (EventCommand command : commands) {
            StreamKey stream = StreamKey.of(tenantId, command);
            long sequence = heads.merge(stream, 1L, Long::sum);
            events.add(new Event(
                UUID.randomUUID(),
                tenantId,
                command.aggregateId(),
                command.aggregateType(),
                command.resourceOwner(),
                sequence,
                command.eventType(),
                command.payload(),
                command.actorId(),
                now
            ));
        }
        return events;
    }

    /**
     * True if no command in the batch checks its expected sequence.
     */
    public boolean isUnchecked() {
        return commands.stream().noneMatch(EventCommand::checksSequence);
    }

    public List<EventCommand> commands() {
        return commands;
    }
}
