package com.identity.engine.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event store and the side-effect dispatcher.
 */
@ConfigurationProperties(prefix = "identity.eventstore")
public class EventStoreProperties {

    /**
     * Upper bound for a single append, including lock waits (default: 15s).
     */
    private Duration pushTimeout = Duration.ofSeconds(15);

    /**
     * Upper bound for waiting on in-flight side-effect events at shutdown (default: 30s).
     */
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Threads appending side-effect events (default: 2).
     */
    private int dispatcherThreads = 2;

    /**
     * Queue capacity of the side-effect executor (default: 1000).
     */
    private int dispatcherQueueCapacity = 1000;

    /**
     * bcrypt cost for client secrets (default: 10).
     */
    private int secretHashStrength = 10;

    /**
     * Length of generated client secrets (default: 64).
     */
    private int generatedSecretLength = 64;

    public Duration getPushTimeout() {
        return pushTimeout;
    }

    public void setPushTimeout(Duration pushTimeout) {
        this.pushTimeout = pushTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getDispatcherThreads() {
        return dispatcherThreads;
    }

    public void setDispatcherThreads(int dispatcherThreads) {
        this.dispatcherThreads = dispatcherThreads;
    }

    public int getDispatcherQueueCapacity() {
        return dispatcherQueueCapacity;
    }

    public void setDispatcherQueueCapacity(int dispatcherQueueCapacity) {
        this.dispatcherQueueCapacity = dispatcherQueueCapacity;
    }

    public int getSecretHashStrength() {
        return secretHashStrength;
    }

    public void setSecretHashStrength(int secretHashStrength) {
        this.secretHashStrength = secretHashStrength;
    }

    public int getGeneratedSecretLength() {
        return generatedSecretLength;
    }

    public void setGeneratedSecretLength(int generatedSecretLength) {
        this.generatedSecretLength = generatedSecretLength;
    }
}
