package com.platform.releasecontroller.status;

import com.platform.releasecontroller.model.ConditionReason;
import com.platform.releasecontroller.model.ReleaseCondition;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds release conditions. The reason fixes the type and status, the clock
 * supplies the transition time.
 */
@Component
public class ReleaseConditions {
    
    private final Clock clock;
    
    public ReleaseConditions(Clock clock) {
        this.clock = clock;
    }
    
    public ReleaseCondition creating() {
        return forReason(ConditionReason.CREATING, "");
    }
    
    public ReleaseCondition updating() {
        return forReason(ConditionReason.UPDATING, "");
    }
    
    public ReleaseCondition rollbacking() {
        return forReason(ConditionReason.ROLLBACKING, "");
    }
    
    public ReleaseCondition available() {
        return forReason(ConditionReason.AVAILABLE, "");
    }
    
    public ReleaseCondition failure(String message) {
        return forReason(ConditionReason.FAILURE, message);
    }
    
    public ReleaseCondition forReason(ConditionReason reason, String message) {
        return new ReleaseCondition(
            reason.getType(),
            reason.getStatus(),
            reason,
            message != null ? message : "",
            clock.instant()
        );
    }
}
