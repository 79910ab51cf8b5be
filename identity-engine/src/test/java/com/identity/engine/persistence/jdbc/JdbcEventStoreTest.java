package com.identity.engine.persistence.jdbc;

import com.identity.core.exception.InternalException;
import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventFilter;
import com.identity.core.model.EventMappers;
import com.identity.core.model.EventType;
import com.identity.core.repository.EventStore;
import com.identity.engine.config.EventStoreProperties;
import com.identity.engine.metrics.EventStoreMetrics;
import com.identity.engine.persistence.EventStoreContractTest;
import com.identity.engine.test.H2Database;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JDBC event store against H2 in PostgreSQL mode.
 */
class JdbcEventStoreTest extends EventStoreContractTest {

    private H2Database db;

    @Override
    protected EventStore createStore() {
        db = H2Database.create();
        return new JdbcEventStore(
            db.jdbcTemplate(),
            db.transactionManager(),
            EventMappers.userMappers(H2Database.objectMapper()),
            new EventStoreProperties(),
            new EventStoreMetrics());
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Test
    @DisplayName("Rows with an event type this build does not know should be skipped")
    void query_shouldSkipUnknownEventTypes() {
        store.append(TENANT, List.of(added("user-1", 0)));
        insertRaw("user-1", 2, "user.human.added", "{}");

        List<Event> events = store.query(EventFilter.forAggregate(TENANT, AggregateType.USER, "user-1"));

        assertThat(events).extracting(Event::eventType).containsExactly(EventType.USER_MACHINE_ADDED);
    }

    @Test
    @DisplayName("An undecodable payload should surface as an internal error")
    void query_shouldFailWithInternalErrorOnMalformedPayload() {
        insertRaw("user-1", 1, EventType.USER_MACHINE_ADDED.value(), "not json");

        assertThatThrownBy(() -> store.query(EventFilter.forAggregate(TENANT, AggregateType.USER, "user-1")))
            .isInstanceOf(InternalException.class)
            .satisfies(e -> assertThat(((InternalException) e).getId()).isEqualTo("EVENT-Dk3lP"));
    }

    @Test
    void storageFailures_shouldBeReportedAsInternalErrors() {
        db.jdbcTemplate().execute("DROP TABLE eventstore.events");

        assertThatThrownBy(() -> store.append(TENANT, List.of(added("user-1", 0))))
            .isInstanceOf(InternalException.class)
            .hasCauseInstanceOf(DataAccessException.class);
        assertThatThrownBy(() -> store.query(EventFilter.forAggregate(TENANT, AggregateType.USER, "user-1")))
            .isInstanceOf(InternalException.class);
        assertThatThrownBy(() -> store.latestSequence(TENANT, AggregateType.USER, "user-1"))
            .isInstanceOf(InternalException.class);
    }

    @Test
    void append_shouldPersistPayloadAsJson() {
        store.append(TENANT, List.of(added("user-1", 0)));

        String payload = db.jdbcTemplate().queryForObject(
            "SELECT payload FROM eventstore.events WHERE aggregate_id = ?", String.class, "user-1");

        assertThat(payload).contains("\"userName\":\"svc-user-1\"");
    }

    @Test
    @DisplayName("Appends should register each stream once in the lock table")
    void append_shouldRegisterStreamOnce() {
        store.append(TENANT, List.of(added("user-1", 0)));
        store.append(TENANT, List.of(command("user-1", EventType.USER_DEACTIVATED, 1)));
        store.append(TENANT, List.of(added("user-2", 0)));

        Long streams = db.jdbcTemplate().queryForObject(
            "SELECT COUNT(*) FROM eventstore.streams WHERE tenant_id = ?", Long.class, TENANT);

        assertThat(streams).isEqualTo(2);
    }

    @Test
    void append_shouldContinueStreamsWrittenBeforeTheLockTableExisted() {
        insertRaw("user-1", 1, EventType.USER_MACHINE_ADDED.value(),
            "{\"userName\":\"svc\",\"name\":\"Service\"}");

        List<Event> events = store.append(TENANT, List.of(command("user-1", EventType.USER_DEACTIVATED, 1)));

        assertThat(events.get(0).sequence()).isEqualTo(2);
    }

    // ========== Helpers ==========

    private void insertRaw(String aggregateId, long sequence, String eventType, String payload) {
        db.jdbcTemplate().update("""
            INSERT INTO eventstore.events (
                event_id, tenant_id, aggregate_type, aggregate_id, resource_owner,
                sequence, event_type, payload, actor_id, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            UUID.randomUUID(), TENANT, AggregateType.USER.value(), aggregateId, "org-1",
            sequence, eventType, payload, "admin", Timestamp.from(Instant.now()));
    }
}
