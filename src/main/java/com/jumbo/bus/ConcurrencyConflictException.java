package com.jumbo.bus;

/**
 * Thrown when an append does not land on the next free slot of its stream.
 * The stream is left exactly as it was.
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long attemptedVersion;

    public ConcurrencyConflictException(String aggregateId, long expectedVersion, long attemptedVersion) {
        super("Concurrency conflict on stream " + aggregateId
            + ": expected version " + expectedVersion + " but got " + attemptedVersion);
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.attemptedVersion = attemptedVersion;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getAttemptedVersion() {
        return attemptedVersion;
    }
}
