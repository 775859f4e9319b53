package com.jumbo.projection.invariant;

public final class InvariantEventTypes {

    public static final String ADDED = "InvariantAddedEvent";
    public static final String UPDATED = "InvariantUpdatedEvent";
    public static final String REMOVED = "InvariantRemovedEvent";

    private InvariantEventTypes() {
    }
}
