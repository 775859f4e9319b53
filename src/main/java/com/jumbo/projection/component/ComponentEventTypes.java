package com.jumbo.projection.component;

public final class ComponentEventTypes {

    public static final String ADDED = "ComponentAddedEvent";
    public static final String UPDATED = "ComponentUpdatedEvent";
    public static final String DEPRECATED = "ComponentDeprecatedEvent";
    public static final String REMOVED = "ComponentRemovedEvent";

    private ComponentEventTypes() {
    }
}
