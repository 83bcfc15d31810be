package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.sop.adapter.inmemory.store.InMemoryWorkflowStore;
import com.ryuqq.sop.adapter.json.JsonSopDefinitionSource;
import com.ryuqq.sop.application.orchestrator.HumanTaskResponse;
import com.ryuqq.sop.core.actor.ActorRegistry;
import com.ryuqq.sop.core.event.WorkflowEventType;
import com.ryuqq.sop.core.message.DeliveryStatus;
import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.record.StepRecord;
import com.ryuqq.sop.core.record.WorkflowInstance;
import com.ryuqq.sop.core.statemachine.StepStatus;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;
import com.ryuqq.sop.testkit.fixture.ScriptedRoleActor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JSON SOP 문서 기반 긴급 유지보수 워크플로우 종단 테스트.
 *
 * <p>안전 위험 판단 → 병렬 출동 → 수리 → 품질 검사 → 작업 지시 종료 경로를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class EmergencyMaintenanceWorkflowTest {

    private static final String SUPERVISOR = "maintenance_supervisor";
    private static final String TECHNICIAN = "maintenance_tech";
    private static final String ASSISTANT_MANAGER = "assistant_manager";

    private InMemoryWorkflowStore store;
    private WorkflowInstanceManager manager;
    private ScriptedRoleActor supervisor;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowStore();
        ActorRegistry actors = new ActorRegistry();
        manager = new WorkflowInstanceManager(JsonSopDefinitionSource.fromClasspath("sops"), store, actors,
            new InMemoryMessageBus(store, actors),
            new EngineConfig().withDefaultStepTimeoutMs(5_000).withShutdownTimeoutMs(1_000));

        supervisor = ScriptedRoleActor.deciding("safety_risk");
        manager.registerActor(SUPERVISOR, supervisor);
        manager.registerEventHandler(WorkflowEventType.HUMAN_ACTION_REQUIRED, event -> {
            String stepId = event.payload().get("step_id").map(Value::asText).orElseThrow();
            manager.completeHumanStep(event.instanceId(), stepId,
                new HumanTaskResponse(true, Value.map(Map.of("note", Value.of("done"))), "field-crew"));
        });
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void 안전_위험_판단시_즉시_출동_경로로_완료() throws Exception {
        // given
        InstanceId id = manager.createInstance("emergency_maintenance", "maintenance_request", "MR-2024-117",
            Value.map(Map.of("unit", Value.of("12A"), "issue", Value.of("gas smell"))));

        // when
        WorkflowStatus status = manager.start(id).await(Duration.ofSeconds(10));

        // then
        assertThat(status).isEqualTo(WorkflowStatus.COMPLETED);
        WorkflowInstance instance = manager.getInstance(id).orElseThrow();
        assertThat(instance.currentStepId()).isEqualTo("close_work_order");
        assertThat(instance.dueAt()).isEqualTo(instance.createdAt().plus(Duration.ofHours(4)));

        List<StepRecord> records = store.findStepsByInstance(id);
        assertThat(records).extracting(StepRecord::stepId).containsExactlyInAnyOrder(
            "acknowledge_request", "assess_severity", "dispatch_immediate", "notify_tenant_eta",
            "arrange_temporary_solution", "perform_repair", "quality_check", "close_work_order");
        assertThat(records).extracting(StepRecord::status).containsOnly(StepStatus.COMPLETED);

        assertThat(supervisor.invocations())
            .contains("decide:assess_severity", "send_eta_notification", "request_feedback")
            .doesNotContain("find_available_tech", "schedule_repair");
    }

    @Test
    void Human_Step마다_담당_Role에게_알림_저장() throws Exception {
        // given
        InstanceId id = manager.createInstance("emergency_maintenance", "maintenance_request", "MR-2024-118",
            Value.emptyMap());

        // when
        manager.start(id).await(Duration.ofSeconds(10));

        // then
        Map<String, DeliveryStatus> notifications = store.allMessages().stream()
            .collect(Collectors.toMap(Message::toRole, Message::status));
        assertThat(notifications).containsOnly(
            Map.entry(ASSISTANT_MANAGER, DeliveryStatus.SENT),
            Map.entry(TECHNICIAN, DeliveryStatus.SENT),
            Map.entry(SUPERVISOR, DeliveryStatus.DELIVERED));
        assertThat(supervisor.receivedMessages()).singleElement()
            .satisfies(message -> assertThat(message.subject()).isEqualTo("Action required: Quality Assurance Check"));
    }
}
