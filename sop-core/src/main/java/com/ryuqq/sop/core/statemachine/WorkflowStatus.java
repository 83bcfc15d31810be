package com.ryuqq.sop.core.statemachine;

/**
 * Workflow 인스턴스의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► IN_PROGRESS (start)
 *    │      ├─► COMPLETED (모든 경로 종료)
 *    │      ├─► FAILED    (Step 실패)
 *    │      └─► CANCELLED (cancel)
 *    │
 *    ├─► FAILED    (start 중 오류)
 *    └─► CANCELLED (시작 전 cancel)
 *
 * 금지된 전이:
 * - COMPLETED / FAILED / CANCELLED → * ❌
 * - IN_PROGRESS → PENDING ❌
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowStatus {

    /**
     * 생성됨 (아직 시작 안 됨).
     */
    PENDING,

    /**
     * Step 그래프 순회 중.
     */
    IN_PROGRESS,

    /**
     * 완료.
     */
    COMPLETED,

    /**
     * 실패.
     */
    FAILED,

    /**
     * 취소됨.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, FAILED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
