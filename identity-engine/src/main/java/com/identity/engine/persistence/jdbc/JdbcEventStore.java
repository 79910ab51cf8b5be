package com.identity.engine.persistence.jdbc;

import com.identity.core.exception.ConcurrencyConflictException;
import com.identity.core.exception.InternalException;
import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventFilter;
import com.identity.core.model.EventMappers;
import com.identity.core.model.EventType;
import com.identity.core.repository.EventStore;
import com.identity.engine.config.EventStoreProperties;
import com.identity.engine.metrics.EventStoreMetrics;
import com.identity.engine.persistence.AppendPlan;
import com.identity.engine.persistence.StreamKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * SQL-backed implementation of EventStore.
 * Provides append-only event sourcing with per-aggregate sequence ordering.
 *
 * Concurrency control: an append first locks the row of every touched stream in
 * {@link StreamKey} order, then reads the current heads and compares them to the expected
 * sequences. Writers of the same stream are serialized by the row lock. The unique key
 * (tenant, aggregate type, aggregate id, sequence) stays as the last guard; a checked batch that
 * hits it is reported as a concurrency conflict, an unchecked one is retried within the push timeout.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String INSERT_SQL = """
        INSERT INTO eventstore.events (
            event_id, tenant_id, aggregate_type, aggregate_id, resource_owner,
            sequence, event_type, payload, actor_id, created_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;

    private static final String HEAD_SQL = """
        SELECT COALESCE(MAX(sequence), 0) FROM eventstore.events
        WHERE tenant_id = ? AND aggregate_type = ? AND aggregate_id = ?
        """;

    private static final String REGISTER_STREAM_SQL = """
        INSERT INTO eventstore.streams (tenant_id, aggregate_type, aggregate_id)
        VALUES (?, ?, ?)
        ON CONFLICT DO NOTHING
        """;

    private static final String LOCK_STREAM_SQL = """
        SELECT aggregate_id FROM eventstore.streams
        WHERE tenant_id = ? AND aggregate_type = ? AND aggregate_id = ?
        FOR UPDATE
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EventMappers eventMappers;
    private final EventStoreMetrics metrics;
    private final Duration pushTimeout;

    public JdbcEventStore(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            EventMappers eventMappers,
            EventStoreProperties properties,
            EventStoreMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout((int) Math.max(1, properties.getPushTimeout().toSeconds()));
        this.eventMappers = eventMappers;
        this.metrics = metrics;
        this.pushTimeout = properties.getPushTimeout();
    }

    @Override
    public List<Event> append(String tenantId, List<EventCommand> commands) {
        if (commands.isEmpty()) {
            return List.of();
        }
        long started = System.nanoTime();
        String aggregateType = commands.get(0).aggregateType().value();
        AppendPlan plan = new AppendPlan(tenantId, commands);
        long deadline = started + pushTimeout.toNanos();

        while (true) {
            try {
                List<Event> events = transactionTemplate.execute(status -> insert(plan));
                metrics.eventsAppended(aggregateType, events.size(), Duration.ofNanos(System.nanoTime() - started));
                log.debug("Appended {} events for tenant {}", events.size(), tenantId);
                return events;
            } catch (ConcurrencyConflictException e) {
                metrics.conflict(aggregateType);
                log.debug("Append rejected: {}", e.getMessage());
                throw e;
            } catch (DuplicateKeyException | ConcurrencyFailureException e) {
                // unchecked batches carry no expectation that a lost race could violate
                if (plan.isUnchecked() && System.nanoTime() < deadline) {
                    log.debug("Unchecked append lost race on aggregate {}, retrying", commands.get(0).aggregateId());
                    continue;
                }
                metrics.conflict(aggregateType);
                log.debug("Append lost race on aggregate {}: {}", commands.get(0).aggregateId(), e.getMessage());
                throw new ConcurrencyConflictException("EVENT-Hq2vW", commands.get(0).aggregateId(), e);
            } catch (DataAccessException | TransactionException e) {
                log.error("Failed to append events for tenant {}: {}", tenantId, e.getMessage());
                throw new InternalException("EVENT-Db9aP", "Errors.Internal", e);
            }
        }
    }

    @Override
    public List<Event> query(EventFilter filter) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
            SELECT event_id, tenant_id, aggregate_type, aggregate_id, resource_owner,
                   sequence, event_type, payload, actor_id, created_at
            FROM eventstore.events
            WHERE tenant_id = ? AND aggregate_type = ? AND sequence >= ?
            """);
        args.add(filter.tenantId());
        args.add(filter.aggregateType().value());
        args.add(filter.fromSequence());

        appendIn(sql, args, "aggregate_id", filter.aggregateIds());
        appendIn(sql, args, "event_type", filter.eventTypes().stream().map(EventType::value).toList());
        sql.append(" ORDER BY sequence ASC, aggregate_id ASC");

        List<Event> events = new ArrayList<>();
        try {
            jdbcTemplate.query(sql.toString(), rs -> {
                mapRow(rs).ifPresent(events::add);
            }, args.toArray());
        } catch (DataAccessException e) {
            log.error("Failed to query events for tenant {}: {}", filter.tenantId(), e.getMessage());
            throw new InternalException("EVENT-Qr5tD", "Errors.Internal", e);
        }
        return events;
    }

    @Override
    public long latestSequence(String tenantId, AggregateType aggregateType, String aggregateId) {
        try {
            Long head = jdbcTemplate.queryForObject(HEAD_SQL, Long.class, tenantId, aggregateType.value(), aggregateId);
            return head == null ? 0 : head;
        } catch (DataAccessException e) {
            throw new InternalException("EVENT-Sq3lQ", "Errors.Internal", e);
        }
    }

    // ========== Internal Methods ==========

    private List<Event> insert(AppendPlan plan) {
        for (StreamKey stream : plan.streams()) {
            lock(stream);
        }
        List<Event> events = plan.toEvents(this::head);
        jdbcTemplate.batchUpdate(INSERT_SQL, events, events.size(), (ps, event) -> {
            ps.setObject(1, event.eventId());
            ps.setString(2, event.tenantId());
            ps.setString(3, event.aggregateType().value());
            ps.setString(4, event.aggregateId());
            ps.setString(5, event.resourceOwner());
            ps.setLong(6, event.sequence());
            ps.setString(7, event.eventType().value());
            ps.setString(8, eventMappers.encode(event.payload()));
            ps.setString(9, event.actorId());
            ps.setTimestamp(10, Timestamp.from(event.timestamp()));
        });
        return events;
    }

    /**
     * Lock the stream row until the transaction ends, creating it on first use.
     */
    private void lock(StreamKey stream) {
        Object[] key = {stream.tenantId(), stream.aggregateType().value(), stream.aggregateId()};
        jdbcTemplate.update(REGISTER_STREAM_SQL, key);
        jdbcTemplate.queryForList(LOCK_STREAM_SQL, String.class, key);
    }

    private long head(StreamKey stream) {
        Long head = jdbcTemplate.queryForObject(
            HEAD_SQL, Long.class, stream.tenantId(), stream.aggregateType().value(), stream.aggregateId());
        return head == null ? 0 : head;
    }

    private static void appendIn(StringBuilder sql, List<Object> args, String column, List<String> values) {
        if (values.isEmpty()) {
            return;
        }
        sql.append(" AND ").append(column).append(" IN (");
        for (int i = 0; i < values.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
            args.add(values.get(i));
        }
        sql.append(')');
    }

    /**
     * Map a row, skipping event types this build does not know.
     */
    private Optional<Event> mapRow(ResultSet rs) throws SQLException {
        String typeValue = rs.getString("event_type");
        Optional<EventType> type = EventType.fromValue(typeValue);
        if (type.isEmpty()) {
            log.warn("Skipping event {} with unknown type {}", rs.getString("event_id"), typeValue);
            return Optional.empty();
        }
        return Optional.of(new Event(
            UUID.fromString(rs.getString("event_id")),
            rs.getString("tenant_id"),
            rs.getString("aggregate_id"),
            AggregateType.fromValue(rs.getString("aggregate_type")),
            rs.getString("resource_owner"),
            rs.getLong("sequence"),
            type.get(),
            eventMappers.decode(type.get(), rs.getString("payload")),
            rs.getString("actor_id"),
            rs.getTimestamp("created_at").toInstant()
        ));
    }
}
