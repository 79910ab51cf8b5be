package com.identity.engine.persistence;

import com.identity.core.exception.ConcurrencyConflictException;
import com.identity.core.model.AggregateType;
import com.identity.core.model.Event;
import com.identity.core.model.EventFilter;
import com.identity.core.repository.EventStore;
import com.identity.engine.metrics.EventStoreMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventStoreTest extends EventStoreContractTest {

    private SimpleMeterRegistry registry;

    @Override
    protected EventStore createStore() {
        registry = new SimpleMeterRegistry();
        EventStoreMetrics metrics = new EventStoreMetrics();
        metrics.bindTo(registry);
        return new InMemoryEventStore(Duration.ofSeconds(5), metrics);
    }

    @Test
    void append_shouldRecordAppendedEventsAndConflicts() {
        store.append(TENANT, List.of(added("user-1", 0)));
        assertThatThrownBy(() -> store.append(TENANT, List.of(added("user-1", 0))))
            .isInstanceOf(ConcurrencyConflictException.class);

        assertThat(registry.get(EventStoreMetrics.EVENTS_APPENDED).counter().count()).isEqualTo(1.0);
        assertThat(registry.get(EventStoreMetrics.APPEND_CONFLICTS).counter().count()).isEqualTo(1.0);
    }

    @Test
    void query_shouldReturnTheEventsAppendReturned() {
        List<Event> appended = store.append(TENANT, List.of(added("user-1", 0)));

        assertThat(store.query(EventFilter.forAggregate(TENANT, AggregateType.USER, "user-1")))
            .isEqualTo(appended);
    }
}
