package com.jumbo.projection.dependency;

public enum DependencyStatus {
    ACTIVE("active"),
    DEPRECATED("deprecated"),
    REMOVED("removed");

    private final String value;

    DependencyStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
