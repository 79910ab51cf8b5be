package com.identity.engine.command;

/**
 * A freshly generated client secret. The plaintext is only available here, once.
 */
public record MachineSecret(String clientId, String clientSecret, ObjectDetails details) {

    @Override
    public String toString() {
        return "MachineSecret[clientId=" + clientId + ", clientSecret=***, details=" + details + "]";
    }
}
