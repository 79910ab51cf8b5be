package com.identity.engine.command;

import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.user.MachineAddedPayload;
import com.identity.core.model.user.MachineChangedPayload;
import com.identity.core.model.user.MachineSecretSetPayload;
import com.identity.core.projection.AccessTokenType;
import com.identity.core.projection.UserState;
import com.identity.core.writemodel.ExistenceWriteModel;
import com.identity.core.writemodel.WriteModel;

/**
 * Full state of a machine user, as needed to validate commands on it.
 * Reads every event of the aggregate so its processed sequence can be used for conflict checks.
 */
public class MachineUserWriteModel extends WriteModel implements ExistenceWriteModel {

    private UserState state = UserState.UNSPECIFIED;
    private String userName;
    private String name;
    private String description;
    private AccessTokenType accessTokenType;
    private String secretHash;

    public MachineUserWriteModel(String tenantId, String userId) {
        super(tenantId, userId);
    }

    @Override
    protected AggregateType aggregateType() {
        return AggregateType.USER;
    }

    @Override
    protected void apply(Event event) {
        switch (event.eventType()) {
            case USER_MACHINE_ADDED -> {
                MachineAddedPayload added = event.payloadAs(MachineAddedPayload.class);
                state = UserState.ACTIVE;
                userName = added.userName();
                name = added.name();
                description = added.description();
                accessTokenType = added.accessTokenType() == null ? AccessTokenType.BEARER : added.accessTokenType();
            }
            case USER_MACHINE_CHANGED -> {
                MachineChangedPayload changed = event.payloadAs(MachineChangedPayload.class);
                if (changed.name() != null) {
                    name = changed.name();
                }
                if (changed.description() != null) {
                    description = changed.description();
                }
                if (changed.accessTokenType() != null) {
                    accessTokenType = changed.accessTokenType();
                }
            }
            case USER_MACHINE_SECRET_SET -> secretHash = event.payloadAs(MachineSecretSetPayload.class).secretHash();
            case USER_MACHINE_SECRET_REMOVED -> secretHash = null;
            case USER_DEACTIVATED -> state = UserState.INACTIVE;
            case USER_REACTIVATED -> state = UserState.ACTIVE;
            case USER_REMOVED -> {
                state = UserState.DELETED;
                secretHash = null;
            }
            default -> {
                // secret checks are observations only
            }
        }
    }

    @Override
    public boolean exists() {
        return state != UserState.UNSPECIFIED && state != UserState.DELETED;
    }

    public UserState getState() {
        return state;
    }

    public String getUserName() {
        return userName;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public AccessTokenType getAccessTokenType() {
        return accessTokenType;
    }

    public boolean hasSecret() {
        return secretHash != null;
    }
}
