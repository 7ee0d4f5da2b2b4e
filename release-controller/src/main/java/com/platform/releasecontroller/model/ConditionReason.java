package com.platform.releasecontroller.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason attached to a release condition.
 * 
 * Each reason maps to exactly one condition type and status:
 * - CREATING, UPDATING, ROLLBACKING: Progressing / True
 * - AVAILABLE: Available / True
 * - FAILURE: Failure / True
 */
public enum ConditionReason {
    CREATING("Creating", ConditionType.PROGRESSING),
    UPDATING("Updating", ConditionType.PROGRESSING),
    ROLLBACKING("Rollbacking", ConditionType.PROGRESSING),
    AVAILABLE("Available", ConditionType.AVAILABLE),
    FAILURE("Failure", ConditionType.FAILURE);
    
    private final String displayName;
    private final ConditionType type;
    
    ConditionReason(String displayName, ConditionType type) {
        this.displayName = displayName;
        this.type = type;
    }
    
    @JsonValue
    public String getDisplayName() {
        return displayName;
    }
    
    public ConditionType getType() {
        return type;
    }
    
    public ConditionStatus getStatus() {
        return ConditionStatus.TRUE;
    }
}
