package com.jumbo.projection.session;

public enum SessionStatus {
    ACTIVE("active"),
    PAUSED("paused"),
    BLOCKED("blocked"),
    ENDED("ended");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
