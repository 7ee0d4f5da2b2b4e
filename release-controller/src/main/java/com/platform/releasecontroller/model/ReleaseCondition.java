package com.platform.releasecontroller.model;

import java.time.Instant;

/**
 * A structured status entry describing one aspect of a release's lifecycle.
 * Built through {@link com.platform.releasecontroller.status.ReleaseConditions}.
 */
public record ReleaseCondition(
    ConditionType type,
    ConditionStatus status,
    ConditionReason reason,
    String message,
    Instant lastTransitionTime
) {
    
    public boolean is(ConditionReason expected) {
        return reason == expected && status == ConditionStatus.TRUE;
    }
}
