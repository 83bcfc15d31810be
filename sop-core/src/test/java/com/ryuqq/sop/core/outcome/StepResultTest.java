package com.ryuqq.sop.core.outcome;

import com.ryuqq.sop.core.actor.Decision;
import com.ryuqq.sop.core.model.Value;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StepResult Sealed Interface 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StepResultTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void completed_Satisfied_IsSuccess() {
        StepResult result = Completed.satisfied(Value.emptyMap(), NOW);

        assertTrue(result.isSuccess());
        assertFalse(result.isFailed());
        assertFalse(result.isTimedOut());
    }

    @Test
    void completed_Unsatisfied_IsNotSuccess() {
        assertFalse(new Completed(false, Value.emptyMap(), NOW).isSuccess());
    }

    @Test
    void timedOut_IsNeverSuccess() {
        StepResult result = new TimedOut(Duration.ofMinutes(30));

        assertFalse(result.isSuccess());
        assertTrue(result.isTimedOut());
        assertEquals("1800000",
            ((Value.MapValue) result.toValue()).get("timeout_ms").orElseThrow().asText());
    }

    @Test
    void failed_ToValue_ContainsError() {
        Value.MapValue value = (Value.MapValue) Failed.of("boom").toValue();
        assertEquals("boom", value.get("error").orElseThrow().asText());
    }

    @Test
    void decision_ReadsDecisionEntryOfOutput() {
        Completed completed = Completed.satisfied(Decision.of("approve", "ok").toValue(), NOW);
        assertEquals("approve", completed.decision().orElseThrow().asText());
    }

    @Test
    void decision_NonMapOutput_ReturnsEmpty() {
        assertTrue(Completed.satisfied(Value.of("plain"), NOW).decision().isEmpty());
    }
}
