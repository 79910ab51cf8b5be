package com.identity.engine.persistence;

import com.identity.core.exception.ConcurrencyConflictException;
import com.identity.core.exception.InternalException;
import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventCommand;
import com.identity.core.model.EventFilter;
import com.identity.core.repository.EventStore;
import com.identity.engine.metrics.EventStoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventStore.
 * For tests and local setups.
 *
 * Appends lock every touched stream, in {@link StreamKey} order, for at most the push timeout.
 * Streams are replaced as a whole under the lock, so readers never see a partial append.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<StreamKey, List<Event>> streams = new ConcurrentHashMap<>();
    private final Map<StreamKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration pushTimeout;
    private final EventStoreMetrics metrics;

    public InMemoryEventStore(Duration pushTimeout, EventStoreMetrics metrics) {
        this.pushTimeout = pushTimeout;
        this.metrics = metrics;
    }

    @Override
    public List<Event> append(String tenantId, List<EventCommand> commands) {
        if (commands.isEmpty()) {
            return List.of();
        }
        long started = System.nanoTime();
        AppendPlan plan = new AppendPlan(tenantId, commands);
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            lockAll(plan, held, started);

            List<Event> events;
            try {
                events = plan.toEvents(this::head);
            } catch (ConcurrencyConflictException e) {
                metrics.conflict(commands.get(0).aggregateType().value());
                log.debug("Append rejected: {}", e.getMessage());
                throw e;
            }

            Map<StreamKey, List<Event>> grouped = events.stream()
                .collect(Collectors.groupingBy(
                    event -> new StreamKey(tenantId, event.aggregateType(), event.aggregateId())));
            grouped.forEach((stream, appended) -> {
                List<Event> updated = new ArrayList<>(streams.getOrDefault(stream, List.of()));
                updated.addAll(appended);
                streams.put(stream, Collections.unmodifiableList(updated));
            });

            metrics.eventsAppended(commands.get(0).aggregateType().value(), events.size(),
                Duration.ofNanos(System.nanoTime() - started));
            log.debug("Appended {} events for tenant {}", events.size(), tenantId);
            return events;
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    @Override
    public List<Event> query(EventFilter filter) {
        List<Event> result = new ArrayList<>();
        for (Map.Entry<StreamKey, List<Event>> entry : streams.entrySet()) {
            StreamKey stream = entry.getKey();
            if (!stream.tenantId().equals(filter.tenantId()) || stream.aggregateType() != filter.aggregateType()) {
                continue;
            }
            for (Event event : entry.getValue()) {
                if (filter.matches(event)) {
                    result.add(event);
                }
            }
        }
        result.sort(Comparator.comparingLong(Event::sequence).thenComparing(Event::aggregateId));
        return result;
    }

    @Override
    public long latestSequence(String tenantId, AggregateType aggregateType, String aggregateId) {
        return head(new StreamKey(tenantId, aggregateType, aggregateId));
    }

    // ========== Internal Methods ==========

    private long head(StreamKey stream) {
        List<Event> events = streams.get(stream);
        return events == null || events.isEmpty() ? 0 : events.get(events.size() - 1).sequence();
    }

    private void lockAll(AppendPlan plan, Deque<ReentrantLock> held, long started) {
        long deadline = started + pushTimeout.toNanos();
        for (StreamKey stream : plan.streams()) {
            ReentrantLock lock = locks.computeIfAbsent(stream, key -> new ReentrantLock());
            try {
                long remaining = deadline - System.nanoTime();
                if (!lock.tryLock(Math.max(remaining, 0), TimeUnit.NANOSECONDS)) {
                    log.warn("Push timeout of {} exceeded waiting for aggregate {}", pushTimeout, stream.aggregateId());
                    throw new InternalException("EVENT-Lk4tO", "Errors.Eventstore.PushTimeout");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InternalException("EVENT-In7rp", "Errors.Eventstore.PushInterrupted", e);
            }
            held.push(lock);
        }
    }
}
