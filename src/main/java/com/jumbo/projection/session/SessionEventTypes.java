package com.jumbo.projection.session;

public final class SessionEventTypes {

    public static final String STARTED = "SessionStartedEvent";
    public static final String PAUSED = "SessionPausedEvent";
    public static final String RESUMED = "SessionResumedEvent";
    public static final String ENDED = "SessionEndedEvent";

    private SessionEventTypes() {
    }
}
