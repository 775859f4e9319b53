package com.jumbo.projection.architecture;

public final class ArchitectureEventTypes {

    public static final String DEFINED = "ArchitectureDefinedEvent";
    public static final String UPDATED = "ArchitectureUpdatedEvent";

    private ArchitectureEventTypes() {
    }
}
