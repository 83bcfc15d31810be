package com.ryuqq.sop.core.evaluation;

import com.ryuqq.sop.core.actor.Decision;
import com.ryuqq.sop.core.model.StepType;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.outcome.Completed;
import com.ryuqq.sop.core.outcome.Failed;
import com.ryuqq.sop.core.outcome.StepResult;
import com.ryuqq.sop.core.outcome.TimedOut;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConditionEvaluator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConditionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private static StepResult decided(String value) {
        return Completed.satisfied(Decision.of(value, "because").toValue(), NOW);
    }

    private static WorkflowStep approvalStep() {
        return WorkflowStep.builder("review", StepType.DECISION)
            .assignedRole("supervisor")
            .condition("decision:approve", "stepX")
            .condition("decision:reject", "stepY")
            .nextSteps("fallback")
            .build();
    }

    @Test
    void nextSteps_DecisionReject_RoutesToRejectBranchOnly() {
        // When
        List<String> next = evaluator.nextSteps(approvalStep(), decided("reject"));

        // Then
        assertEquals(List.of("stepY"), next);
    }

    @Test
    void nextSteps_DecisionWithoutMatchingBranch_FallsBackToNextSteps() {
        assertEquals(List.of("fallback"), evaluator.nextSteps(approvalStep(), decided("defer")));
    }

    @Test
    void nextSteps_NumericDecision_ComparedByText() {
        // Given
        WorkflowStep step = WorkflowStep.builder("score", StepType.DECISION)
            .assignedRole("analyst")
            .condition("decision:3", "three")
            .build();
        StepResult result = Completed.satisfied(new Decision(Value.of(3), Value.nullValue()).toValue(), NOW);

        // When & Then
        assertEquals(List.of("three"), evaluator.nextSteps(step, result));
    }

    @Test
    void nextSteps_FirstMatchingConditionWins() {
        // Given
        WorkflowStep step = WorkflowStep.builder("work", StepType.AUTOMATED)
            .assignedRole("operator")
            .condition("success", "first")
            .condition("decision:approve", "second")
            .build();

        // When & Then
        assertEquals(List.of("first"), evaluator.nextSteps(step, decided("approve")));
    }

    @Test
    void nextSteps_UnsatisfiedCompletion_RoutesThroughFailure() {
        // Given
        WorkflowStep step = WorkflowStep.builder("work", StepType.AUTOMATED)
            .assignedRole("operator")
            .condition("success", "done")
            .condition("failure", "escalate")
            .build();
        StepResult unsatisfied = new Completed(false, Value.emptyMap(), NOW);

        // When & Then
        assertEquals(List.of("escalate"), evaluator.nextSteps(step, unsatisfied));
        assertEquals(List.of("done"), evaluator.nextSteps(step, Completed.satisfied(Value.emptyMap(), NOW)));
    }

    @Test
    void nextSteps_TimedOut_MatchesFailureNeverSuccess() {
        // Given
        WorkflowStep step = WorkflowStep.builder("wait", StepType.HUMAN_ACTION)
            .assignedRole("technician")
            .condition("success", "done")
            .condition("failure", "escalate")
            .build();

        // When & Then
        assertEquals(List.of("escalate"), evaluator.nextSteps(step, new TimedOut(Duration.ofMinutes(5))));
    }

    @Test
    void nextSteps_UnrecognizedConditions_NeverMatch() {
        // Given
        WorkflowStep step = WorkflowStep.builder("assess", StepType.DECISION)
            .assignedRole("supervisor")
            .condition("safety_risk", "dispatch")
            .nextSteps("default")
            .build();

        // When & Then
        assertEquals(List.of("default"), evaluator.nextSteps(step, decided("safety_risk")));
    }

    @Test
    void nextSteps_NoConditions_ReturnsNextStepsVerbatim() {
        // Given
        WorkflowStep step = WorkflowStep.builder("fan", StepType.PARALLEL)
            .assignedRole("coordinator")
            .nextSteps("b", "a", "c")
            .build();

        // When & Then
        assertEquals(List.of("b", "a", "c"), evaluator.nextSteps(step, Failed.of("boom")));
    }

    @Test
    void nextSteps_RepeatedCalls_ReturnIdenticalOutput() {
        WorkflowStep step = approvalStep();
        StepResult result = decided("approve");

        assertEquals(evaluator.nextSteps(step, result), evaluator.nextSteps(step, result));
    }

    @Test
    void matches_DecisionOnFailedResult_IsFalse() {
        assertTrue(evaluator.firstMatch(approvalStep(), Failed.of("boom")).isEmpty());
    }
}
