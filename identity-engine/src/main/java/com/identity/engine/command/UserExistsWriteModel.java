package com.identity.engine.command;

import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventType;
import com.identity.core.writemodel.ExistenceWriteModel;
import com.identity.core.writemodel.WriteModel;

/**
 * Tracks only whether a user exists. Reads the whole stream so the processed sequence
 * can serve as expected sequence for a create.
 */
public class UserExistsWriteModel extends WriteModel implements ExistenceWriteModel {

    private boolean exists;

    public UserExistsWriteModel(String tenantId, String userId) {
        super(tenantId, userId);
    }

    @Override
    protected AggregateType aggregateType() {
        return AggregateType.USER;
    }

    @Override
    protected void apply(Event event) {
        if (event.eventType() == EventType.USER_MACHINE_ADDED) {
            exists = true;
        } else if (event.eventType() == EventType.USER_REMOVED) {
            exists = false;
        }
    }

    @Override
    public boolean exists() {
        return exists;
    }
}
