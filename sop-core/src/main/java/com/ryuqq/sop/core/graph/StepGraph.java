package com.ryuqq.sop.core.graph;

import com.ryuqq.sop.core.exception.DefinitionException;
import com.ryuqq.sop.core.model.SopDefinition;
import com.ryuqq.sop.core.model.WorkflowStep;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * SOP Step 그래프 조회 유틸리티.
 *
 * <p>Step ID 인덱스를 한 번 구성해 두고 진입 Step 탐색과 ID 기반 조회를 제공합니다.
 * 불변 객체이므로 여러 스레드(Parallel 분기)가 공유해도 안전합니다.</p>
 *
 * <p><strong>진입 Step 규칙:</strong></p>
 * <ul>
 *   <li>다른 Step의 next_steps에서 참조되지 않는 Step 중 선언 순서상 첫 번째</li>
 *   <li>그런 Step이 없으면 (모든 Step이 참조됨) 첫 번째로 선언된 Step</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepGraph {

    private final SopDefinition definition;
    private final Map<String, WorkflowStep> index;
    private final WorkflowStep entryStep;

    private StepGraph(SopDefinition definition) {
        this.definition = definition;
        Map<String, WorkflowStep> byId = new LinkedHashMap<>();
        for (WorkflowStep step : definition.steps()) {
            byId.put(step.stepId(), step);
        }
        this.index = Collections.unmodifiableMap(byId);
        this.entryStep = resolveEntry(definition);
    }

    /**
     * SopDefinition으로부터 그래프 생성.
     *
     * @param definition SOP 정의
     * @return StepGraph
     * @throws IllegalArgumentException definition이 null인 경우
     */
    public static StepGraph of(SopDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        return new StepGraph(definition);
    }

    private static WorkflowStep resolveEntry(SopDefinition definition) {
        Set<String> referenced = new HashSet<>();
        for (WorkflowStep step : definition.steps()) {
            for (String next : step.nextSteps()) {
                if (!next.equals(step.stepId())) {
                    referenced.add(next);
                }
            }
        }
        for (WorkflowStep step : definition.steps()) {
            if (!referenced.contains(step.stepId())) {
                return step;
            }
        }
        return definition.steps().get(0);
    }

    /**
     * 진입 Step 조회.
     *
     * @return 진입 Step (항상 존재)
     */
    public WorkflowStep entryStep() {
        return entryStep;
    }

    /**
     * ID로 Step 조회.
     *
     * @param stepId Step ID
     * @return Step (없으면 empty)
     */
    public Optional<WorkflowStep> find(String stepId) {
        return Optional.ofNullable(index.get(stepId));
    }

    /**
     * ID로 Step 조회 (반드시 존재해야 함).
     *
     * @param stepId Step ID
     * @return Step
     * @throws DefinitionException 정의에 없는 Step ID인 경우
     */
    public WorkflowStep require(String stepId) {
        WorkflowStep step = index.get(stepId);
        if (step == null) {
            throw new DefinitionException(
                "Step '" + stepId + "' is not defined in SOP '" + definition.name() + "'");
        }
        return step;
    }
}
