package com.jumbo.rebuild;

import com.jumbo.contract.EventEnvelope;

/**
 * A rebuild step failed. {@code position} is the 1-based index in the global log of the
 * envelope being replayed, or 0 when the failure happened outside the replay loop.
 */
public class ReplayFailureException extends RuntimeException {

    private final RebuildPhase phase;
    private final int position;

    public ReplayFailureException(int position, EventEnvelope event, Throwable cause) {
        super("Replay failed at event " + position + " (" + event.type() + " on "
            + event.aggregateId() + " v" + event.version() + "): " + cause.getMessage(), cause);
        this.phase = RebuildPhase.REPLAYING_LOG;
        this.position = position;
    }

    public ReplayFailureException(RebuildPhase phase, Throwable cause) {
        super("Rebuild failed during " + phase + ": " + cause.getMessage(), cause);
        this.phase = phase;
        this.position = 0;
    }

    public RebuildPhase getPhase() {
        return phase;
    }

    public int getPosition() {
        return position;
    }
}
