package com.identity.engine.persistence;

import com.identity.core.model.AggregateType;
import com.identity.core.model.EventCommand;
import java.util.Comparator;

/**
 * Identity of one event stream. Ordered so locks can be taken in a fixed order.
 */
public record StreamKey(String tenantId, AggregateType aggregateType, String aggregateId)
        implements Comparable<StreamKey> {

    private static final Comparator<StreamKey> ORDER = Comparator
        .comparing(StreamKey::tenantId)
        .thenComparing(StreamKey::aggregateType)
        .thenComparing(StreamKey::aggregateId);

    public static StreamKey of(String tenantId, EventCommand command) {
        return new StreamKey(tenantId, command.aggregateType(), command.aggregateId());
    }

    @Override
    public int compareTo(StreamKey other) {
        return ORDER.compare(this, other);
    }
}
