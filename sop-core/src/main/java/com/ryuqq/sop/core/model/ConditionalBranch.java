package com.ryuqq.sop.core.model;

/**
 * 조건과 그 조건이 일치할 때 이동할 Step의 쌍.
 *
 * @param condition 분기 조건
 * @param targetStepId 이동할 Step ID
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ConditionalBranch(
    StepCondition condition,
    String targetStepId
) {

    public ConditionalBranch {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (targetStepId == null || targetStepId.isBlank()) {
            throw new IllegalArgumentException("targetStepId cannot be null or blank");
        }
    }

    /**
     * 조건 문자열로 ConditionalBranch 생성.
     *
     * @param expression 조건 문자열 (예: decision:approve)
     * @param targetStepId 이동할 Step ID
     * @return ConditionalBranch
     */
    public static ConditionalBranch of(String expression, String targetStepId) {
        return new ConditionalBranch(StepCondition.parse(expression), targetStepId);
    }
}
