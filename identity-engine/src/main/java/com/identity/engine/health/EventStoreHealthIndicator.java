package com.identity.engine.health;

import com.identity.engine.dispatch.AsyncEventDispatcher;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for the identity engine.
 * Reports health status based on:
 * - Database connectivity
 * - Event log reachability
 * - Side-effect dispatcher state
 */
public class EventStoreHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;
    private final AsyncEventDispatcher dispatcher;

    public EventStoreHealthIndicator(JdbcTemplate jdbcTemplate, AsyncEventDispatcher dispatcher) {
        this.jdbcTemplate = jdbcTemplate;
        this.dispatcher = dispatcher;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        boolean dbHealthy = checkDatabase(details);
        checkDispatcher(details);

        if (!dbHealthy) {
            return Health.down()
                .withDetails(details)
                .build();
        }
        if (dispatcher.isShuttingDown()) {
            return Health.outOfService()
                .withDetails(details)
                .build();
        }
        return Health.up()
            .withDetails(details)
            .build();
    }

    private boolean checkDatabase(Map<String, Object> details) {
        try {
            Integer result = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            // reads at most one row, the log is never scanned
            jdbcTemplate.queryForList("SELECT sequence FROM eventstore.events LIMIT 1", Long.class);
            details.put("eventLog", "reachable");
            return result != null && result == 1;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }

    private void checkDispatcher(Map<String, Object> details) {
        details.put("sideEffectsInFlight", dispatcher.inFlightCount());
        details.put("shuttingDown", dispatcher.isShuttingDown());
    }
}
