package com.ryuqq.sop.core.evaluation;

import com.ryuqq.sop.core.model.ConditionalBranch;
import com.ryuqq.sop.core.model.StepCondition;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.outcome.Completed;
import com.ryuqq.sop.core.outcome.StepResult;

import java.util.List;
import java.util.Optional;

/**
 * Step 결과로부터 후속 Step을 결정.
 *
 * <p>순수 함수입니다. 같은 입력에 대해 항상 같은 결과를 반환하며 상태를 갖지 않습니다.</p>
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ul>
 *   <li>conditions를 선언 순서대로 평가, 처음 일치한 분기의 대상이 유일한 후속 Step</li>
 *   <li>{@code success}: Completed이며 criteria 충족</li>
 *   <li>{@code failure}: success가 아닌 모든 결과 (TimedOut, Failed 포함)</li>
 *   <li>{@code decision:<v>}: Completed 출력의 decision 값이 텍스트로 v와 일치</li>
 *   <li>해석 불가 조건은 항상 불일치</li>
 *   <li>conditions가 없거나 일치하는 분기가 없으면 next_steps 그대로</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConditionEvaluator {

    /**
     * 후속 Step ID 목록 계산.
     *
     * @param step 방금 실행한 Step
     * @param result 실행 결과
     * @return 후속 Step ID 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException step 또는 result가 null인 경우
     */
    public List<String> nextSteps(WorkflowStep step, StepResult result) {
        if (step == null || result == null) {
            throw new IllegalArgumentException("step and result cannot be null");
        }
        Optional<ConditionalBranch> match = firstMatch(step, result);
        if (match.isPresent()) {
            return List.of(match.get().targetStepId());
        }
        return step.nextSteps();
    }

    /**
     * 처음 일치하는 조건 분기 조회.
     *
     * @param step Step
     * @param result 실행 결과
     * @return 일치한 분기 (없으면 empty)
     */
    public Optional<ConditionalBranch> firstMatch(WorkflowStep step, StepResult result) {
        for (ConditionalBranch branch : step.conditions()) {
            if (matches(branch.condition(), result)) {
                return Optional.of(branch);
            }
        }
        return Optional.empty();
    }

    /**
     * 단일 조건 평가.
     *
     * @param condition 조건
     * @param result 실행 결과
     * @return 일치 여부
     */
    public boolean matches(StepCondition condition, StepResult result) {
        if (condition instanceof StepCondition.Success) {
            return result.isSuccess();
        }
        if (condition instanceof StepCondition.Failure) {
            return !result.isSuccess();
        }
        if (condition instanceof StepCondition.DecisionEquals decisionEquals) {
            if (result instanceof Completed completed) {
                return completed.decision()
                    .map(Value::asText)
                    .filter(decisionEquals.value()::equals)
                    .isPresent();
            }
            return false;
        }
        return false;
    }
}
