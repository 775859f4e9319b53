package com.jumbo.projection.guideline;

public final class GuidelineEventTypes {

    public static final String ADDED = "GuidelineAddedEvent";
    public static final String UPDATED = "GuidelineUpdatedEvent";
    public static final String REMOVED = "GuidelineRemovedEvent";

    private GuidelineEventTypes() {
    }
}
