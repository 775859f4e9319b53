package com.jumbo.projection.decision;

public enum DecisionStatus {
    ACTIVE("active"),
    REVERSED("reversed"),
    SUPERSEDED("superseded");

    private final String value;

    DecisionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
