package com.platform.releasecontroller.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aspect of a release's lifecycle that a condition describes.
 */
public enum ConditionType {
    PROGRESSING("Progressing"),
    AVAILABLE("Available"),
    FAILURE("Failure");
    
    private final String displayName;
    
    ConditionType(String displayName) {
        this.displayName = displayName;
    }
    
    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Available and Failure are mutually exclusive outcomes.
     */
    public boolean isOutcome() {
        return this == AVAILABLE || this == FAILURE;
    }
}
