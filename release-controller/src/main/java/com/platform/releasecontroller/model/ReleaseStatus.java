package com.platform.releasecontroller.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Observed state of a release, written only by the release manager.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReleaseStatus {
    
    /**
     * Last applied history version, 0 when never deployed.
     */
    private int version;
    
    /**
     * Rendered manifest of the last applied version.
     */
    private String manifest;
    
    /**
     * Generation of the spec that produced {@link #version}.
     */
    private long observedGeneration;
    
    private Instant lastUpdateTime;
    
    @Builder.Default
    private List<ReleaseCondition> conditions = new ArrayList<>();
    
    /**
     * Replace the condition of the same type. Available and Failure evict each other,
     * and both evict Progressing, so a finished attempt leaves a single condition.
     */
    public void setCondition(ReleaseCondition condition) {
        List<ReleaseCondition> next = new ArrayList<>();
        for (ReleaseCondition existing : conditions) {
            if (existing.type() == condition.type()) {
                continue;
            }
            if (condition.type().isOutcome() && 
                (existing.type().isOutcome() || existing.type() == ConditionType.PROGRESSING)) {
                continue;
            }
            next.add(existing);
        }
        next.add(condition);
        conditions = next;
    }
    
    public Optional<ReleaseCondition> getCondition(ConditionType type) {
        return conditions.stream()
            .filter(c -> c.type() == type)
            .findFirst();
    }
    
    public boolean hasCondition(ConditionReason reason) {
        return conditions.stream().anyMatch(c -> c.is(reason));
    }
    
    public ReleaseStatus copy() {
        return toBuilder()
            .conditions(new ArrayList<>(conditions))
            .build();
    }
}
