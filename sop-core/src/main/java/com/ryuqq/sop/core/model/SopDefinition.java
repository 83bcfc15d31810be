package com.ryuqq.sop.core.model;

import com.ryuqq.sop.core.exception.DefinitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * SOP (Standard Operating Procedure) 정의.
 *
 * <p>인스턴스 생성 시 읽기 전용으로 로드되며, 생성 시점에 그래프 무결성을 검증합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>Step이 하나 이상 존재</li>
 *   <li>Step ID는 정의 내에서 고유</li>
 *   <li>next_steps 및 조건 분기가 참조하는 Step ID는 모두 정의 내에 존재</li>
 * </ul>
 *
 * @param name SOP 이름 (정의 조회 키)
 * @param description 설명
 * @param steps 선언 순서의 Step 목록
 * @param requiredRoles 실행에 필요한 Role 목록
 * @param escalationPath 에스컬레이션 Role 체인 (낮은 권한 → 높은 권한)
 * @param timeLimit 전체 처리 시간 제한 (null이면 제한 없음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SopDefinition(
    String name,
    String description,
    List<WorkflowStep> steps,
    List<String> requiredRoles,
    List<String> escalationPath,
    Duration timeLimit
) {

    /**
     * Compact Constructor.
     *
     * @throws DefinitionException 불변식을 위반한 경우
     */
    public SopDefinition {
        if (name == null || name.isBlank()) {
            throw new DefinitionException("SOP name cannot be null or blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new DefinitionException("SOP '" + name + "' must declare at least one step");
        }
        if (timeLimit != null && (timeLimit.isNegative() || timeLimit.isZero())) {
            throw new DefinitionException("SOP '" + name + "' time limit must be positive");
        }
        description = description == null ? "" : description;
        steps = List.copyOf(steps);
        requiredRoles = List.copyOf(requiredRoles == null ? List.of() : requiredRoles);
        escalationPath = List.copyOf(escalationPath == null ? List.of() : escalationPath);
        validateGraph(name, steps);
    }

    private static void validateGraph(String name, List<WorkflowStep> steps) {
        Set<String> ids = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!ids.add(step.stepId())) {
                throw new DefinitionException("SOP '" + name + "' declares duplicate step id: " + step.stepId());
            }
        }
        for (WorkflowStep step : steps) {
            for (String next : step.nextSteps()) {
                if (!ids.contains(next)) {
                    throw new DefinitionException(
                        String.format("SOP '%s' step '%s' references unknown next step: %s", name, step.stepId(), next));
                }
            }
            for (ConditionalBranch branch : step.conditions()) {
                if (!ids.contains(branch.targetStepId())) {
                    throw new DefinitionException(
                        String.format("SOP '%s' step '%s' condition '%s' references unknown step: %s",
                            name, step.stepId(), branch.condition().expression(), branch.targetStepId()));
                }
            }
        }
    }

    /**
     * 시작 시각 기준 처리 기한 계산.
     *
     * @param from 기준 시각
     * @return 기한 (시간 제한이 없으면 empty)
     */
    public Optional<Instant> dueAt(Instant from) {
        return timeLimit == null ? Optional.empty() : Optional.of(from.plus(timeLimit));
    }
}
