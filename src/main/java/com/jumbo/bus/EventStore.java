package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;

import java.util.List;

public interface EventStore {

    /**
     * Appends one envelope to the end of its aggregate's stream.
     *
     * @throws ConcurrencyConflictException when {@code event.version()} is not the stream length + 1
     */
    AppendResult append(EventEnvelope event);

    List<EventEnvelope> readStream(String aggregateId);

    /** Every stored envelope in recording order, each stream's internal order preserved. */
    List<EventEnvelope> getAllEvents();
}
