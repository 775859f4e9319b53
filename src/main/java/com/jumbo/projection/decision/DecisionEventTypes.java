package com.jumbo.projection.decision;

public final class DecisionEventTypes {

    public static final String ADDED = "DecisionAddedEvent";
    public static final String UPDATED = "DecisionUpdatedEvent";
    public static final String REVERSED = "DecisionReversedEvent";
    public static final String SUPERSEDED = "DecisionSupersededEvent";

    private DecisionEventTypes() {
    }
}
