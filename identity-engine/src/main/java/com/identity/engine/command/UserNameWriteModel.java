package com.identity.engine.command;

import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.user.UserNameReservedPayload;
import com.identity.core.writemodel.ExistenceWriteModel;
import com.identity.core.writemodel.WriteModel;

/**
 * Claim on a user name within a tenant.
 * Reads the whole claim stream so a reservation can be appended with its processed sequence;
 * two users racing for the same name then conflict in the event store.
 */
public class UserNameWriteModel extends WriteModel implements ExistenceWriteModel {

    private String userId;

    public UserNameWriteModel(String tenantId, String userName) {
        super(tenantId, userName);
    }

    @Override
    protected AggregateType aggregateType() {
        return AggregateType.USER_NAME;
    }

    @Override
    protected void apply(Event event) {
        switch (event.eventType()) {
            case USER_NAME_RESERVED -> userId = event.payloadAs(UserNameReservedPayload.class).userId();
            case USER_NAME_RELEASED -> userId = null;
            default -> {
                // not a claim event
            }
        }
    }

    /**
     * True while some user holds the name.
     */
    @Override
    public boolean exists() {
        return userId != null;
    }

    /**
     * User currently holding the name, or null.
     */
    public String getUserId() {
        return userId;
    }
}
