package com.platform.releasecontroller.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConditionStatus {
    TRUE("True"),
    FALSE("False"),
    UNKNOWN("Unknown");
    
    private final String displayName;
    
    ConditionStatus(String displayName) {
        this.displayName = displayName;
    }
    
    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
}
