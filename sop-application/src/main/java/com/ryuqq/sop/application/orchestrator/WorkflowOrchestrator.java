package com.ryuqq.sop.application.orchestrator;

import com.ryuqq.sop.core.actor.RoleActor;
import com.ryuqq.sop.core.event.WorkflowEventHandler;
import com.ryuqq.sop.core.event.WorkflowEventType;
import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.record.WorkflowInstance;

import java.util.Optional;

/**
 * SOP Workflow 인스턴스 실행 조정자.
 *
 * <p>트리거로부터 인스턴스를 생성하고, Step 그래프 순회를 시작/취소하며,
 * 대기 중인 Human Action Step을 외부 응답으로 재개합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * orchestrator.registerActor("maintenance_technician", technicianActor);
 * orchestrator.registerEventHandler(WorkflowEventType.WORKFLOW_FAILED, event -&gt; alert(event));
 *
 * InstanceId id = orchestrator.createInstance("emergency_maintenance", "work_order", "WO-1001", data);
 * WorkflowHandle handle = orchestrator.start(id);
 *
 * WorkflowStatus status = handle.await(Duration.ofMinutes(5));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowOrchestrator {

    /**
     * 인스턴스 생성 (PENDING).
     *
     * <p>SOP 정의의 시간 제한으로 처리 기한을 계산하고 PENDING 레코드를 저장한 뒤
     * 인메모리 컨텍스트를 생성합니다.</p>
     *
     * @param sopName SOP 이름
     * @param triggerType 트리거 유형
     * @param triggerId 트리거 ID
     * @param initialData 트리거 입력 데이터
     * @return 생성된 인스턴스 ID
     * @throws com.ryuqq.sop.core.exception.DefinitionException SOP 정의를 찾을 수 없는 경우
     */
    InstanceId createInstance(String sopName, String triggerType, String triggerId, Value.MapValue initialData);

    /**
     * 인스턴스 실행 시작.
     *
     * <p>이미 IN_PROGRESS인 인스턴스에 대한 재호출은 무시되며, 실행 중인 순회의 핸들을 반환합니다.</p>
     *
     * @param instanceId 인스턴스 ID
     * @return 실행 핸들
     * @throws IllegalArgumentException 알 수 없는 인스턴스인 경우
     * @throws IllegalStateException 이미 종료된 인스턴스인 경우
     */
    WorkflowHandle start(InstanceId instanceId);

    /**
     * 인스턴스 취소.
     *
     * @param instanceId 인스턴스 ID
     * @param reason 취소 사유
     * @return 취소된 경우 true, 이미 종료되었거나 알 수 없는 인스턴스인 경우 false
     */
    boolean cancel(InstanceId instanceId, String reason);

    /**
     * 대기 중인 Human Action Step에 응답.
     *
     * @param instanceId 인스턴스 ID
     * @param stepId Step ID
     * @param response 담당자 응답
     * @return 대기 중인 Step이 있어 재개된 경우 true
     */
    boolean completeHumanStep(InstanceId instanceId, String stepId, HumanTaskResponse response);

    /**
     * 영속화된 인스턴스 레코드 조회.
     *
     * @param instanceId 인스턴스 ID
     * @return 인스턴스 레코드 (없으면 empty)
     */
    Optional<WorkflowInstance> getInstance(InstanceId instanceId);

    void registerActor(String role, RoleActor actor);

    void registerEventHandler(WorkflowEventType type, WorkflowEventHandler handler);

    /**
     * Role 간 메시지 전송.
     *
     * @param draft 메시지
     * @return 메시지 ID
     */
    MessageId sendMessage(MessageDraft draft);

    /**
     * 실행 중인 순회를 중단하고 스레드 풀을 종료.
     */
    void shutdown();
}
