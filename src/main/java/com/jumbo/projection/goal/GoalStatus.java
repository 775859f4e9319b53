package com.jumbo.projection.goal;

public enum GoalStatus {
    TO_DO("to-do"),
    DOING("doing"),
    BLOCKED("blocked"),
    PAUSED("paused"),
    COMPLETED("completed"),
    IN_REVIEW("in-review");

    private final String value;

    GoalStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
