package com.jumbo.projection.component;

public enum ComponentStatus {
    ACTIVE("active"),
    DEPRECATED("deprecated"),
    REMOVED("removed");

    private final String value;

    ComponentStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
