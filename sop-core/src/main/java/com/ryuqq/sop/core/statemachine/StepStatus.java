package com.ryuqq.sop.core.statemachine;

/**
 * Step 실행 레코드의 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS | SKIPPED</li>
 *   <li>IN_PROGRESS → COMPLETED | FAILED | TIMED_OUT | SKIPPED</li>
 * </ul>
 *
 * <p>SKIPPED는 취소로 중단된 Step에 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StepStatus {

    PENDING,

    IN_PROGRESS,

    COMPLETED,

    FAILED,

    /**
     * 취소 등으로 실행되지 않고 종료됨.
     */
    SKIPPED,

    /**
     * 기한 내 결과 없음.
     */
    TIMED_OUT;

    /**
     * 종료 상태인지 확인.
     *
     * @return PENDING, IN_PROGRESS가 아닌 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING && this != IN_PROGRESS;
    }
}
