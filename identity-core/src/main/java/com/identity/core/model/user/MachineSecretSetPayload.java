package com.identity.core.model.user;

import com.identity.core.model.EventPayload;

/**
 * Carries the hashed client secret. The plaintext is never persisted.
 */
public record MachineSecretSetPayload(String secretHash) implements EventPayload {

    @Override
    public String toString() {
        return "MachineSecretSetPayload[secretHash=***]";
    }
}
