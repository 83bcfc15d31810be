package com.ryuqq.sop.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SOP 그래프의 노드 하나.
 *
 * <p>로드된 이후 변경되지 않습니다. {@code timeout}이 {@link Duration#ZERO}이면
 * 엔진 설정의 기본 타임아웃이 적용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * WorkflowStep step = WorkflowStep.builder("assess_severity", StepType.DECISION)
 *     .name("Assess Severity and Safety")
 *     .assignedRole("maintenance_supervisor")
 *     .timeout(Duration.ofMinutes(10))
 *     .condition("decision:safety_risk", "dispatch_immediate")
 *     .condition("decision:no_safety_risk", "schedule_emergency")
 *     .build();
 * </pre>
 *
 * @param stepId SOP 내 고유 ID
 * @param name 표시 이름
 * @param description 담당자에게 전달되는 설명
 * @param type Step 유형
 * @param assignedRole 담당 Role 이름
 * @param actions action 이름 목록 (순서 유지)
 * @param completionCriteria 완료 기준
 * @param timeout 타임아웃 (ZERO는 기본값 사용)
 * @param nextSteps 정적 후속 Step ID 목록
 * @param conditions 조건 분기 목록 (선언 순서대로 평가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowStep(
    String stepId,
    String name,
    String description,
    StepType type,
    String assignedRole,
    List<String> actions,
    CompletionCriteria completionCriteria,
    Duration timeout,
    List<String> nextSteps,
    List<ConditionalBranch> conditions
) {

    public WorkflowStep {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null (stepId: " + stepId + ")");
        }
        if (assignedRole == null || assignedRole.isBlank()) {
            throw new IllegalArgumentException("assignedRole cannot be null or blank (stepId: " + stepId + ")");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (stepId: " + stepId + ")");
        }
        name = name == null || name.isBlank() ? stepId : name;
        description = description == null ? "" : description;
        actions = List.copyOf(actions == null ? List.of() : actions);
        completionCriteria = completionCriteria == null ? CompletionCriteria.none() : completionCriteria;
        nextSteps = List.copyOf(nextSteps == null ? List.of() : nextSteps);
        conditions = List.copyOf(conditions == null ? List.of() : conditions);
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    /**
     * 정의 문서 표기의 조건 Map (선언 순서 유지).
     *
     * @return 조건 문자열 → 대상 Step ID
     */
    public Map<String, String> conditionExpressions() {
        Map<String, String> expressions = new LinkedHashMap<>();
        for (ConditionalBranch branch : conditions) {
            expressions.put(branch.condition().expression(), branch.targetStepId());
        }
        return expressions;
    }

    public static Builder builder(String stepId, StepType type) {
        return new Builder(stepId, type);
    }

    /**
     * WorkflowStep 빌더.
     */
    public static final class Builder {

        private final String stepId;
        private final StepType type;
        private String name;
        private String description;
        private String assignedRole;
        private final List<String> actions = new ArrayList<>();
        private CompletionCriteria completionCriteria = CompletionCriteria.none();
        private Duration timeout = Duration.ZERO;
        private final List<String> nextSteps = new ArrayList<>();
        private final List<ConditionalBranch> conditions = new ArrayList<>();

        private Builder(String stepId, StepType type) {
            this.stepId = stepId;
            this.type = type;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder assignedRole(String assignedRole) {
            this.assignedRole = assignedRole;
            return this;
        }

        public Builder actions(String... actions) {
            this.actions.addAll(List.of(actions));
            return this;
        }

        public Builder actions(List<String> actions) {
            this.actions.addAll(actions);
            return this;
        }

        public Builder completionCriteria(CompletionCriteria completionCriteria) {
            this.completionCriteria = completionCriteria;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder nextSteps(String... nextSteps) {
            this.nextSteps.addAll(List.of(nextSteps));
            return this;
        }

        public Builder nextSteps(List<String> nextSteps) {
            this.nextSteps.addAll(nextSteps);
            return this;
        }

        public Builder condition(String expression, String targetStepId) {
            this.conditions.add(ConditionalBranch.of(expression, targetStepId));
            return this;
        }

        public Builder condition(ConditionalBranch branch) {
            this.conditions.add(branch);
            return this;
        }

        public WorkflowStep build() {
            return new WorkflowStep(stepId, name, description, type, assignedRole,
                actions, completionCriteria, timeout, nextSteps, conditions);
        }
    }
}
