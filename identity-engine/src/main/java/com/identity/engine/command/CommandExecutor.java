package com.identity.engine.command;

import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventFilter;
import com.identity.core.repository.EventStore;
import com.identity.core.writemodel.AppendReducer;
import com.identity.core.writemodel.ExistenceWriteModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Runs commands against the event store.
 *
 * A command reduces the write-models it depends on, validates, then appends all of its
 * events in one atomic call. Concurrency conflicts are returned to the caller; nothing is
 * retried here.
 */
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private final EventStore eventStore;

    public CommandExecutor(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    /**
     * Check every precondition, then append the supplied commands.
     * The supplier is only called once all preconditions passed.
     *
     * @return the appended events
     */
    public List<Event> execute(String tenantId, List<Precondition> preconditions,
                               Supplier<List<EventCommand>> commands) {
        for (Precondition precondition : preconditions) {
            precondition.check(this);
        }
        return push(tenantId, commands.get());
    }

    /**
     * Load the events a write-model asks for and fold them in.
     */
    public void reduce(AppendReducer model) {
        List<Event> events = eventStore.query(model.query());
        model.appendEvents(events);
        model.reduce();
    }

    public boolean exists(ExistenceWriteModel model) {
        reduce(model);
        return model.exists();
    }

    public List<Event> push(String tenantId, List<EventCommand> commands) {
        List<Event> events = eventStore.append(tenantId, commands);
        log.debug("Pushed {} events", events.size());
        return events;
    }

    /**
     * Append, then fold the appended events into the already reduced model without re-reading.
     * The events returned by the store are authoritative.
     */
    public List<Event> pushAppendAndReduce(String tenantId, AppendReducer model, List<EventCommand> commands) {
        EventFilter filter = model.query();
        List<Event> events = push(tenantId, commands);
        model.appendEvents(events.stream().filter(filter::matches).toList());
        model.reduce();
        return events;
    }
}
