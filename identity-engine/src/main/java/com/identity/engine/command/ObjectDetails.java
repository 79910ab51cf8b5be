package com.identity.engine.command;

import com.identity.core.model.Event;
import com.identity.core.writemodel.WriteModel;
import java.time.Instant;
import java.util.List;

/**
 * Where an aggregate stands after a command.
 */
public record ObjectDetails(long sequence, Instant changeDate, String resourceOwner) {

    public static ObjectDetails fromWriteModel(WriteModel model) {
        return new ObjectDetails(model.getProcessedSequence(), model.getChangeDate(), model.getResourceOwner());
    }

    /**
     * Details of the last appended event.
     */
    public static ObjectDetails fromEvents(List<Event> events) {
        Event last = events.get(events.size() - 1);
        return new ObjectDetails(last.sequence(), last.timestamp(), last.resourceOwner());
    }
}
