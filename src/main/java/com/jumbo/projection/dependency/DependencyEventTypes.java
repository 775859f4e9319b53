package com.jumbo.projection.dependency;

public final class DependencyEventTypes {

    public static final String ADDED = "DependencyAddedEvent";
    public static final String UPDATED = "DependencyUpdatedEvent";
    public static final String REMOVED = "DependencyRemovedEvent";

    private DependencyEventTypes() {
    }
}
