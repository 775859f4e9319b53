package com.jumbo.projection.goal;

public final class GoalEventTypes {

    public static final String ADDED = "GoalAddedEvent";
    public static final String STARTED = "GoalStartedEvent";
    public static final String UPDATED = "GoalUpdatedEvent";
    public static final String BLOCKED = "GoalBlockedEvent";
    public static final String UNBLOCKED = "GoalUnblockedEvent";
    public static final String PAUSED = "GoalPausedEvent";
    public static final String RESUMED = "GoalResumedEvent";
    public static final String COMPLETED = "GoalCompletedEvent";
    public static final String SUBMITTED_FOR_REVIEW = "GoalSubmittedForReviewEvent";
    public static final String RESET = "GoalResetEvent";
    public static final String REMOVED = "GoalRemovedEvent";
    public static final String PROGRESS_UPDATED = "GoalProgressUpdatedEvent";

    private GoalEventTypes() {
    }
}
