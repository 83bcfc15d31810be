package com.ryuqq.sop.core.event;

/**
 * 엔진이 발행하는 이벤트 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum WorkflowEventType {

    /**
     * Human Action Step이 담당자 입력을 기다리기 시작함.
     */
    HUMAN_ACTION_REQUIRED,

    WORKFLOW_COMPLETED,

    WORKFLOW_FAILED,

    WORKFLOW_CANCELLED
}
