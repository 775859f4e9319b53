package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;

import java.util.List;

/**
 * Raised by a bus when handlers failed for one envelope. The first failure is the cause,
 * any further ones are attached as suppressed exceptions.
 */
public class EventDispatchException extends RuntimeException {

    private final transient EventEnvelope event;
    private final int failureCount;

    public EventDispatchException(EventEnvelope event, List<? extends Throwable> failures) {
        super(failures.size() + " handler(s) failed for " + event.type()
            + " on " + event.aggregateId() + " v" + event.version(), failures.get(0));
        this.event = event;
        this.failureCount = failures.size();
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i));
        }
    }

    public EventEnvelope getEvent() {
        return event;
    }

    public int getFailureCount() {
        return failureCount;
    }
}
