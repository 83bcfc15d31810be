package com.ryuqq.sop.core.record;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.StepType;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.statemachine.StepStatus;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowInstance / StepRecord 상태 변경 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowInstanceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-01T00:05:00Z");

    private static WorkflowInstance pending() {
        return WorkflowInstance.pending(InstanceId.of("inst-1"), "maintenance", "work_order", "WO-1",
            Value.map(Map.of("unit", Value.of("4B"))), T0, null);
    }

    @Test
    void start_FromPending_SetsStartedAt() {
        // When
        WorkflowInstance started = pending().start(T1);

        // Then
        assertEquals(WorkflowStatus.IN_PROGRESS, started.status());
        assertEquals(T1, started.startedAt());
        assertEquals("work_order", started.triggerType());
    }

    @Test
    void fail_RecordsErrorAndCompletionTime() {
        // When
        WorkflowInstance failed = pending().start(T0).fail("Step a failed: boom", T1);

        // Then
        assertEquals(WorkflowStatus.FAILED, failed.status());
        assertEquals("Step a failed: boom", failed.error().orElseThrow());
        assertEquals(T1, failed.completedAt());
    }

    @Test
    void start_FromCompleted_ThrowsException() {
        WorkflowInstance completed = pending().start(T0).complete(T1);
        assertThrows(IllegalStateException.class, () -> completed.start(T1));
    }

    @Test
    void atStep_KeepsStatusAndUpdatesPointer() {
        // When
        WorkflowInstance moved = pending().start(T0).atStep("dispatch", "technician");

        // Then
        assertEquals(WorkflowStatus.IN_PROGRESS, moved.status());
        assertEquals("dispatch", moved.currentStepId());
        assertEquals("technician", moved.currentRole());
    }

    @Test
    void stepRecord_FinishTwice_ThrowsException() {
        // Given
        WorkflowStep step = WorkflowStep.builder("a", StepType.AUTOMATED).assignedRole("operator").build();
        StepRecord record = StepRecord.started(InstanceId.of("inst-1"), step, T0, T1);

        // When
        StepRecord done = record.finish(StepStatus.COMPLETED, Value.emptyMap(), T1);

        // Then
        assertEquals(StepStatus.IN_PROGRESS, record.status());
        assertEquals(StepStatus.COMPLETED, done.status());
        assertEquals(record.recordId(), done.recordId());
        assertThrows(IllegalStateException.class, () -> done.finish(StepStatus.FAILED, Value.emptyMap(), T1));
    }
}
