package com.ryuqq.sop.testkit.fixture;

import com.ryuqq.sop.core.model.CompletionCriteria;
import com.ryuqq.sop.core.model.SopDefinition;
import com.ryuqq.sop.core.model.StepType;
import com.ryuqq.sop.core.model.WorkflowStep;

import java.time.Duration;
import java.util.List;

/**
 * Ready-made SOP definitions and step builders for tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SopFixtures {

    public static final String OPERATOR = "operator";
    public static final String SUPERVISOR = "supervisor";
    public static final String TECHNICIAN = "technician";
    public static final String COORDINATOR = "coordinator";

    // Utility class - prevent instantiation
    private SopFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static SopDefinition definition(String name, WorkflowStep... steps) {
        return new SopDefinition(name, name + " fixture", List.of(steps), List.of(), List.of(), null);
    }

    /**
     * Automated step with a single action named after the step, requiring all actions to complete.
     *
     * @param stepId the step id
     * @param role the assigned role
     * @param nextSteps static successors
     * @return the step
     */
    public static WorkflowStep automated(String stepId, String role, String... nextSteps) {
        return WorkflowStep.builder(stepId, StepType.AUTOMATED)
            .assignedRole(role)
            .actions(stepId + "_action")
            .completionCriteria(CompletionCriteria.allActionsCompleted())
            .nextSteps(nextSteps)
            .build();
    }

    public static WorkflowStep humanAction(String stepId, String role, Duration timeout, String... nextSteps) {
        return WorkflowStep.builder(stepId, StepType.HUMAN_ACTION)
            .assignedRole(role)
            .description("Complete " + stepId)
            .actions(stepId + "_task")
            .timeout(timeout)
            .nextSteps(nextSteps)
            .build();
    }

    public static WorkflowStep parallel(String stepId, String... branches) {
        return WorkflowStep.builder(stepId, StepType.PARALLEL)
            .assignedRole(COORDINATOR)
            .nextSteps(branches)
            .build();
    }

    /**
     * step1 → step2, both automated and assigned to {@link #OPERATOR}.
     *
     * @return the definition
     */
    public static SopDefinition sequential() {
        return definition("sequential",
            automated("step1", OPERATOR, "step2"),
            automated("step2", OPERATOR));
    }

    /**
     * Decision step "review" routing approve → stepX and reject → stepY.
     *
     * @return the definition
     */
    public static SopDefinition approval() {
        WorkflowStep review = WorkflowStep.builder("review", StepType.DECISION)
            .assignedRole(SUPERVISOR)
            .condition("decision:approve", "stepX")
            .condition("decision:reject", "stepY")
            .build();
        return definition("approval",
            review,
            automated("stepX", OPERATOR),
            automated("stepY", OPERATOR));
    }

    /**
     * Parallel step fanning out to three automated branches that join on "report".
     *
     * @return the definition
     */
    public static SopDefinition fanOut() {
        return definition("fan_out",
            parallel("fan", "branch_a", "branch_b", "branch_c"),
            automated("branch_a", TECHNICIAN, "report"),
            automated("branch_b", TECHNICIAN, "report"),
            automated("branch_c", TECHNICIAN, "report"),
            automated("report", OPERATOR));
    }
}
