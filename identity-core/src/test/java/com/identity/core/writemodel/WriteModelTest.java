package com.identity.core.writemodel;

import com.identity.core.model.AggregateType;
import com.identity.core.model.EmptyPayload;
import com.identity.core.model.Event;
import com.identity.core.model.EventFilter;
import com.identity.core.model.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WriteModelTest {

    @Test
    @DisplayName("Reduce should apply buffered events in sequence order")
    void reduce_shouldApplyInSequenceOrder() {
        RecordingModel model = new RecordingModel();

        model.appendEvents(List.of(event(3), event(1), event(2)));
        model.reduce();

        assertEquals(List.of(1L, 2L, 3L), model.applied);
        assertEquals(3, model.getProcessedSequence());
        assertEquals("org-1", model.getResourceOwner());
        assertNotNull(model.getChangeDate());
    }

    @Test
    @DisplayName("Reduce should reject an event that is not newer than the processed one")
    void reduce_shouldRejectRepeatedSequence() {
        RecordingModel model = new RecordingModel();
        model.appendEvents(List.of(event(1), event(2)));
        model.reduce();

        model.appendEvents(List.of(event(2)));

        assertThrows(IllegalStateException.class, model::reduce);
        assertEquals(List.of(1L, 2L), model.applied);
    }

    @Test
    void reduce_shouldRejectEventsOfOtherAggregates() {
        RecordingModel model = new RecordingModel();
        Event foreign = new Event(UUID.randomUUID(), "tenant-1", "user-2", AggregateType.USER, "org-1",
            1, EventType.USER_REMOVED, EmptyPayload.INSTANCE, "admin", Instant.now());

        model.appendEvents(List.of(foreign));

        assertThrows(IllegalStateException.class, model::reduce);
    }

    @Test
    void query_shouldAskOnlyForUnprocessedEvents() {
        RecordingModel model = new RecordingModel();
        model.appendEvents(List.of(event(1), event(2)));
        model.reduce();

        EventFilter filter = model.query();

        assertEquals("tenant-1", filter.tenantId());
        assertEquals(List.of("user-1"), filter.aggregateIds());
        assertEquals(3, filter.fromSequence());
        assertFalse(filter.matches(event(2)));
        assertTrue(filter.matches(event(3)));
    }

    @Test
    void reduce_withoutEvents_shouldLeaveModelUntouched() {
        RecordingModel model = new RecordingModel();

        model.reduce();

        assertEquals(0, model.getProcessedSequence());
        assertNull(model.getChangeDate());
    }

    private static Event event(long sequence) {
        return new Event(UUID.randomUUID(), "tenant-1", "user-1", AggregateType.USER, "org-1",
            sequence, EventType.USER_MACHINE_CHANGED, EmptyPayload.INSTANCE, "admin",
            Instant.parse("2024-01-15T10:00:00Z").plusSeconds(sequence));
    }

    private static class RecordingModel extends WriteModel {

        private final List<Long> applied = new ArrayList<>();

        RecordingModel() {
            super("tenant-1", "user-1");
        }

        @Override
        protected AggregateType aggregateType() {
            return AggregateType.USER;
        }

        @Override
        protected void apply(Event event) {
            applied.add(event.sequence());
        }
    }
}
