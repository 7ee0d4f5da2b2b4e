package com.platform.releasecontroller.status;

import com.platform.releasecontroller.model.ConditionReason;
import com.platform.releasecontroller.model.ConditionStatus;
import com.platform.releasecontroller.model.ConditionType;
import com.platform.releasecontroller.model.ReleaseCondition;
import com.platform.releasecontroller.model.ReleaseStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

final class ReleaseConditionsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ReleaseConditions conditions = new ReleaseConditions(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void reasonsMapToFixedTypes() {
        Assertions.assertEquals(ConditionType.PROGRESSING, conditions.creating().type());
        Assertions.assertEquals(ConditionType.PROGRESSING, conditions.updating().type());
        Assertions.assertEquals(ConditionType.PROGRESSING, conditions.rollbacking().type());
        Assertions.assertEquals(ConditionType.AVAILABLE, conditions.available().type());
        Assertions.assertEquals(ConditionType.FAILURE, conditions.failure("boom").type());

        for (ConditionReason reason : ConditionReason.values()) {
            ReleaseCondition condition = conditions.forReason(reason, null);
            Assertions.assertEquals(ConditionStatus.TRUE, condition.status());
            Assertions.assertEquals(reason, condition.reason());
            Assertions.assertEquals("", condition.message());
            Assertions.assertEquals(NOW, condition.lastTransitionTime());
        }
    }

    @Test
    void failureKeepsMessage() {
        ReleaseCondition failure = conditions.failure("template is empty");

        Assertions.assertEquals("template is empty", failure.message());
        Assertions.assertTrue(failure.is(ConditionReason.FAILURE));
    }

    @Test
    void outcomeConditionsLeaveASingleCondition() {
        ReleaseStatus status = new ReleaseStatus();

        status.setCondition(conditions.creating());
        status.setCondition(conditions.available());
        Assertions.assertEquals(1, status.getConditions().size());
        Assertions.assertTrue(status.hasCondition(ConditionReason.AVAILABLE));

        status.setCondition(conditions.updating());
        Assertions.assertEquals(2, status.getConditions().size());

        status.setCondition(conditions.failure("apply failed"));
        Assertions.assertEquals(1, status.getConditions().size());
        Assertions.assertTrue(status.getCondition(ConditionType.FAILURE).isPresent());
        Assertions.assertTrue(status.getCondition(ConditionType.AVAILABLE).isEmpty());
    }

    @Test
    void sameTypeIsReplaced() {
        ReleaseStatus status = new ReleaseStatus();

        status.setCondition(conditions.creating());
        status.setCondition(conditions.rollbacking());

        Assertions.assertEquals(1, status.getConditions().size());
        Assertions.assertTrue(status.hasCondition(ConditionReason.ROLLBACKING));
    }
}
