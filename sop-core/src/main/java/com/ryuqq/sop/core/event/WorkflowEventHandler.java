package com.ryuqq.sop.core.event;

/**
 * 워크플로우 이벤트 핸들러.
 *
 * <p>핸들러가 던진 예외는 로그로 남고 엔진 흐름에 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkflowEventHandler {

    /**
     * 이벤트 처리.
     *
     * @param event 이벤트
     */
    void handle(WorkflowEvent event);
}
