package com.ryuqq.sop.core.record;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.statemachine.StateTransition;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * 영속화되는 Workflow 인스턴스 레코드.
 *
 * <p>불변 레코드이며 상태 변경은 새 인스턴스를 반환합니다. 모든 상태 변경은
 * {@link StateTransition}으로 검증되므로 상태는 단조적으로만 진행합니다.</p>
 *
 * @param id 인스턴스 ID
 * @param sopName SOP 이름
 * @param triggerType 트리거 유형 (예: work_order)
 * @param triggerId 트리거 ID
 * @param initialContext 트리거 입력 데이터 (그대로 보관)
 * @param status 상태
 * @param currentStepId 현재 Step ID (nullable)
 * @param currentRole 현재 담당 Role (nullable)
 * @param lastError 마지막 오류 메시지 (nullable)
 * @param createdAt 생성 시각
 * @param startedAt 시작 시각 (nullable)
 * @param completedAt 종료 시각 (nullable)
 * @param dueAt 처리 기한 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkflowInstance(
    InstanceId id,
    String sopName,
    String triggerType,
    String triggerId,
    Value.MapValue initialContext,
    WorkflowStatus status,
    String currentStepId,
    String currentRole,
    String lastError,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant dueAt
) {

    public WorkflowInstance {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (sopName == null || sopName.isBlank()) {
            throw new IllegalArgumentException("sopName cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        initialContext = initialContext == null ? Value.emptyMap() : initialContext;
    }

    /**
     * PENDING 상태의 새 인스턴스 생성.
     *
     * @param id 인스턴스 ID
     * @param sopName SOP 이름
     * @param triggerType 트리거 유형
     * @param triggerId 트리거 ID
     * @param initialContext 트리거 입력 데이터
     * @param createdAt 생성 시각
     * @param dueAt 처리 기한 (nullable)
     * @return WorkflowInstance
     */
    public static WorkflowInstance pending(InstanceId id, String sopName, String triggerType, String triggerId,
                                           Value.MapValue initialContext, Instant createdAt, Instant dueAt) {
        return new WorkflowInstance(id, sopName, triggerType, triggerId, initialContext,
            WorkflowStatus.PENDING, null, null, null, createdAt, null, null, dueAt);
    }

    /**
     * IN_PROGRESS로 전이.
     *
     * @param at 시작 시각
     * @return 새 레코드
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public WorkflowInstance start(Instant at) {
        WorkflowStatus next = StateTransition.transition(status, WorkflowStatus.IN_PROGRESS);
        return new WorkflowInstance(id, sopName, triggerType, triggerId, initialContext,
            next, currentStepId, currentRole, lastError, createdAt, at, completedAt, dueAt);
    }

    public WorkflowInstance complete(Instant at) {
        return terminate(WorkflowStatus.COMPLETED, lastError, at);
    }

    public WorkflowInstance fail(String error, Instant at) {
        return terminate(WorkflowStatus.FAILED, error, at);
    }

    public WorkflowInstance cancel(String reason, Instant at) {
        return terminate(WorkflowStatus.CANCELLED, reason, at);
    }

    private WorkflowInstance terminate(WorkflowStatus target, String error, Instant at) {
        WorkflowStatus next = StateTransition.transition(status, target);
        return new WorkflowInstance(id, sopName, triggerType, triggerId, initialContext,
            next, currentStepId, currentRole, error, createdAt, startedAt, at, dueAt);
    }

    /**
     * 현재 Step/Role 갱신 (상태는 그대로).
     *
     * @param stepId Step ID
     * @param role 담당 Role
     * @return 새 레코드
     */
    public WorkflowInstance atStep(String stepId, String role) {
        return new WorkflowInstance(id, sopName, triggerType, triggerId, initialContext,
            status, stepId, role, lastError, createdAt, startedAt, completedAt, dueAt);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Optional<String> error() {
        return Optional.ofNullable(lastError);
    }

    public Optional<Instant> due() {
        return Optional.ofNullable(dueAt);
    }
}
