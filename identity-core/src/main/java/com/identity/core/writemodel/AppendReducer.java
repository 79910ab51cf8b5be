package com.identity.core.writemodel;

import com.identity.core.model.Event;
import com.identity.core.model.EventFilter;
import java.util.List;

/**
 * Something that can be rebuilt from events: tells which events it needs,
 * buffers them, then folds them into its state.
 */
public interface AppendReducer {

    /**
     * Events this model needs to reach the current state.
     */
    EventFilter query();

    /**
     * Buffer events for the next {@link #reduce()}.
     */
    void appendEvents(List<Event> events);

    /**
     * Fold buffered events into state, in sequence order.
     *
     * @throws IllegalStateException if an event is not newer than the last processed one
     */
    void reduce();
}
