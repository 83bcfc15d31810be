package com.ryuqq.sop.core.context;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.outcome.Completed;
import com.ryuqq.sop.core.outcome.Failed;
import com.ryuqq.sop.core.outcome.StepResult;
import com.ryuqq.sop.core.outcome.TimedOut;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowContext 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowContextTest {

    @Test
    void recordResult_OnlyCompletedResultsAppendToCompletedSteps() {
        // Given
        WorkflowContext context = new WorkflowContext(InstanceId.of("i-1"), "manual", "t-1", null);

        // When
        context.recordResult("a", Completed.satisfied(Value.emptyMap(), Instant.now()));
        context.recordResult("b", Failed.of("boom"));
        context.recordResult("c", new TimedOut(Duration.ofSeconds(1)));
        context.recordResult("d", new Completed(false, Value.emptyMap(), Instant.now()));

        // Then
        assertEquals(List.of("a", "d"), context.completedSteps());
        assertEquals(List.of("a", "b", "c", "d"), List.copyOf(context.stepResults().keySet()));
    }

    @Test
    void markCancelled_OnlyFirstCallReportsTransition() {
        WorkflowContext context = new WorkflowContext(InstanceId.of("i-1"), null, null, null);

        assertTrue(context.markCancelled());
        assertFalse(context.markCancelled());
        assertTrue(context.isCancelled());
    }

    @Test
    void stepResults_IsSnapshot() {
        // Given
        WorkflowContext context = new WorkflowContext(InstanceId.of("i-1"), null, null, null);
        context.recordResult("a", Failed.of("x"));

        // When
        Map<String, StepResult> snapshot = context.stepResults();
        context.recordResult("b", Failed.of("y"));

        // Then
        assertEquals(1, snapshot.size());
    }
}
