package com.ryuqq.sop.core.record;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.statemachine.StateTransition;
import com.ryuqq.sop.core.statemachine.StepStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Step 실행 1회에 대한 영속 레코드.
 *
 * <p>같은 Step이 여러 번 실행되면 (순환 그래프) 실행마다 별도 레코드가 생성됩니다.</p>
 *
 * @param recordId 레코드 ID
 * @param instanceId 인스턴스 ID
 * @param stepId Step ID
 * @param stepName Step 이름
 * @param assignedRole 담당 Role
 * @param status 상태
 * @param startedAt 시작 시각
 * @param deadline 기한
 * @param completedAt 종료 시각 (nullable)
 * @param result 결과 (종료 전에는 NullValue)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StepRecord(
    String recordId,
    InstanceId instanceId,
    String stepId,
    String stepName,
    String assignedRole,
    StepStatus status,
    Instant startedAt,
    Instant deadline,
    Instant completedAt,
    Value result
) {

    public StepRecord {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId cannot be null or blank");
        }
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        result = result == null ? Value.nullValue() : result;
    }

    /**
     * IN_PROGRESS 상태로 시작하는 레코드 생성.
     *
     * @param instanceId 인스턴스 ID
     * @param step 실행할 Step
     * @param startedAt 시작 시각
     * @param deadline 기한
     * @return StepRecord
     */
    public static StepRecord started(InstanceId instanceId, WorkflowStep step, Instant startedAt, Instant deadline) {
        return new StepRecord(UUID.randomUUID().toString(), instanceId, step.stepId(), step.name(),
            step.assignedRole(), StepStatus.IN_PROGRESS, startedAt, deadline, null, Value.nullValue());
    }

    /**
     * 종료 상태로 전이.
     *
     * @param next 종료 상태
     * @param result 결과
     * @param at 종료 시각
     * @return 새 레코드
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public StepRecord finish(StepStatus next, Value result, Instant at) {
        StepStatus target = StateTransition.transition(status, next);
        return new StepRecord(recordId, instanceId, stepId, stepName, assignedRole,
            target, startedAt, deadline, at, result);
    }
}
