package com.ryuqq.sop.core.outcome;

import com.ryuqq.sop.core.model.Value;

/**
 * Step 실행 결과.
 *
 * <p>StepResult는 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Completed}: 실행 완료 (completion criteria 충족 여부 포함)</li>
 *   <li>{@link Failed}: Actor 오류 등으로 실행 실패</li>
 *   <li>{@link TimedOut}: 기한 내 결과 없음</li>
 * </ul>
 *
 * <p>criteria를 충족하지 못한 Completed 결과도 정상 결과이며,
 * 조건 평가 시 {@code failure} 분기로 라우팅됩니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (result instanceof Completed completed) {
 *     return completed.output();
 * } else if (result instanceof Failed failed) {
 *     throw new IllegalStateException(failed.error());
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface StepResult permits Completed, Failed, TimedOut {

    /**
     * {@code success} 조건에 해당하는지 확인.
     *
     * @return Completed이며 criteria를 충족한 경우 true
     */
    default boolean isSuccess() {
        return this instanceof Completed completed && completed.satisfied();
    }

    default boolean isFailed() {
        return this instanceof Failed;
    }

    default boolean isTimedOut() {
        return this instanceof TimedOut;
    }

    /**
     * 영속화 및 Actor 입력에 사용할 Value 표현.
     *
     * @return 결과 Value
     */
    Value toValue();
}
