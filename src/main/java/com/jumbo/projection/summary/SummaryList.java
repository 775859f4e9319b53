package com.jumbo.projection.summary;

/**
 * The append-only entry lists of a session summary, with their column names.
 */
public enum SummaryList {
    COMPLETED_GOALS("completedGoals"),
    BLOCKERS_ENCOUNTERED("blockersEncountered"),
    DECISIONS("decisions"),
    GOALS_STARTED("goalsStarted"),
    GOALS_PAUSED("goalsPaused"),
    GOALS_RESUMED("goalsResumed");

    private final String column;

    SummaryList(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
