package com.identity.core.repository;

import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventFilter;
import java.util.List;

/**
 * Append-only event log.
 * Events are immutable once appended.
 */
public interface EventStore {

    /**
     * Append events atomically.
     *
     * Sequences are assigned contiguously per aggregate, continuing from the current latest
     * sequence. Either every command is persisted or none is.
     *
     * @param tenantId tenant all commands belong to
     * @param commands commands in the order their events should be sequenced
     * @return the persisted events, in command order
     * @throws com.identity.core.exception.ConcurrencyConflictException if an aggregate advanced past
     *         a command's expected sequence
     * @throws com.identity.core.exception.InternalException on storage failure or push timeout
     */
    List<Event> append(String tenantId, List<EventCommand> commands);

    /**
     * Get events matching the filter, ascending by sequence.
     */
    List<Event> query(EventFilter filter);

    /**
     * Get the latest sequence of an aggregate.
     *
     * @return latest sequence, 0 if the aggregate has no events
     */
    long latestSequence(String tenantId, AggregateType aggregateType, String aggregateId);
}
