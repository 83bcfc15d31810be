package com.ryuqq.sop.core.event;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;

import java.time.Instant;

/**
 * 이벤트 핸들러에 전달되는 이벤트.
 *
 * <p><strong>payload 구성:</strong></p>
 * <ul>
 *   <li>HUMAN_ACTION_REQUIRED: step_id, role, actions, deadline</li>
 *   <li>WORKFLOW_COMPLETED: completed_steps</li>
 *   <li>WORKFLOW_FAILED: error</li>
 *   <li>WORKFLOW_CANCELLED: reason</li>
 * </ul>
 *
 * @param type 이벤트 유형
 * @param instanceId 인스턴스 ID
 * @param payload 이벤트 데이터
 * @param occurredAt 발생 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowEvent(
    WorkflowEventType type,
    InstanceId instanceId,
    Value.MapValue payload,
    Instant occurredAt
) {

    public WorkflowEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        payload = payload == null ? Value.emptyMap() : payload;
    }
}
