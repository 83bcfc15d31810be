package com.ryuqq.sop.core.message;

/**
 * Role 간 메시지 유형.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MessageType {

    /**
     * 작업 요청.
     */
    REQUEST,

    /**
     * 요청에 대한 응답.
     */
    RESPONSE,

    /**
     * 상위 Role로의 에스컬레이션.
     */
    ESCALATION,

    /**
     * 알림 (예: Human Action 필요).
     */
    NOTIFICATION,

    /**
     * 담당 Role 인계.
     */
    HANDOFF
}
