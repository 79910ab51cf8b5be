package com.identity.core.exception;

/**
 * Thrown when an append targets an aggregate that has advanced past the expected sequence.
 * Callers decide whether to re-reduce and retry; the engine never retries on its own.
 */
public class ConcurrencyConflictException extends IdentityException {

    public static final String ERROR_CODE = "CONCURRENCY_CONFLICT";
    public static final String LOCALIZATION_KEY = "Errors.Eventstore.ConcurrencyConflict";

    private final String aggregateId;
    private final long expectedSequence;
    private final long actualSequence;

    public ConcurrencyConflictException(String id, String aggregateId, long expectedSequence, long actualSequence) {
        super(ERROR_CODE, id, LOCALIZATION_KEY);
        this.aggregateId = aggregateId;
        this.expectedSequence = expectedSequence;
        this.actualSequence = actualSequence;
    }

    public ConcurrencyConflictException(String id, String aggregateId, Throwable cause) {
        super(ERROR_CODE, id, LOCALIZATION_KEY, cause);
        this.aggregateId = aggregateId;
        this.expectedSequence = -1;
        this.actualSequence = -1;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    /**
     * @return the sequence the caller reduced, or -1 if the conflict was detected by the storage layer
     */
    public long getExpectedSequence() {
        return expectedSequence;
    }

    public long getActualSequence() {
        return actualSequence;
    }

    @Override
    public String getMessage() {
        if (expectedSequence < 0) {
            return String.format("Concurrent modification of aggregate %s (%s)", aggregateId, getId());
        }
        return String.format(
            "Concurrent modification of aggregate %s: expected sequence %d, actual sequence %d (%s)",
            aggregateId, expectedSequence, actualSequence, getId());
    }
}
