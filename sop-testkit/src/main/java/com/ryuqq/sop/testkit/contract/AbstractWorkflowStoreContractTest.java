package com.ryuqq.sop.testkit.contract;

import com.ryuqq.sop.core.message.DeliveryStatus;
import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.message.MessageType;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.model.StepType;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.record.StepRecord;
import com.ryuqq.sop.core.record.WorkflowInstance;
import com.ryuqq.sop.core.spi.WorkflowStore;
import com.ryuqq.sop.core.statemachine.StepStatus;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract Contract Test for {@link WorkflowStore} implementations.
 *
 * <p>Every store adapter extends this class and supplies a fresh store through
 * {@link #createStore()}. The inherited tests pin down the behaviour the engine
 * relies on.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>Round-trip: an inserted instance reloads with the same trigger type, trigger id and initial context</li>
 *   <li>Inserting an existing id fails with IllegalStateException, not PersistenceException</li>
 *   <li>Updating an unknown id fails with IllegalStateException, not PersistenceException</li>
 *   <li>Unknown ids resolve to empty results, never null</li>
 *   <li>Step records of one instance are listed in insertion order</li>
 * </ul>
 *
 * <p>PersistenceException is reserved for infrastructure failures, which a contract run
 * against a healthy store cannot provoke. Adapters cover that path in their own tests.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class JdbcWorkflowStoreContractTest extends AbstractWorkflowStoreContractTest {
 *     {@literal @}Override
 *     protected WorkflowStore createStore() {
 *         return new JdbcWorkflowStore(dataSource);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractWorkflowStoreContractTest {

    protected static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    protected static final Instant T1 = Instant.parse("2024-03-01T09:05:00Z");

    protected WorkflowStore store;

    /**
     * Creates the store under test.
     *
     * @return a fresh, empty store
     */
    protected abstract WorkflowStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    /**
     * Creates a PENDING instance with a nested initial context.
     *
     * @param id the instance id value
     * @return a new instance record
     */
    protected WorkflowInstance createTestInstance(String id) {
        Map<String, Value> data = new LinkedHashMap<>();
        data.put("unit", Value.of("4B"));
        data.put("priority", Value.of(2));
        data.put("tags", Value.list(List.of(Value.of("plumbing"), Value.of("urgent"))));
        return WorkflowInstance.pending(InstanceId.of(id), "emergency_maintenance", "work_order", "WO-" + id,
            Value.map(data), T0, T1);
    }

    protected StepRecord createTestStepRecord(InstanceId instanceId, String stepId) {
        WorkflowStep step = WorkflowStep.builder(stepId, StepType.AUTOMATED).assignedRole("operator").build();
        return StepRecord.started(instanceId, step, T0, T1);
    }

    protected Message createTestMessage() {
        return MessageDraft.of("system", "technician", MessageType.NOTIFICATION, "Action required", "Fix it")
            .toMessage(MessageId.random(), T0);
    }

    // ===== Instances =====

    @Test
    void insertInstance_RoundTrip_PreservesTriggerAndInitialContext() {
        // Given
        WorkflowInstance instance = createTestInstance("rt-1");

        // When
        store.insertInstance(instance);
        WorkflowInstance reloaded = store.findInstance(instance.id()).orElseThrow();

        // Then
        assertEquals("work_order", reloaded.triggerType());
        assertEquals("WO-rt-1", reloaded.triggerId());
        assertEquals(instance.initialContext(), reloaded.initialContext());
        assertEquals(WorkflowStatus.PENDING, reloaded.status());
        assertEquals(T1, reloaded.dueAt());
    }

    @Test
    void insertInstance_DuplicateId_ThrowsException() {
        WorkflowInstance instance = createTestInstance("dup-1");
        store.insertInstance(instance);

        assertThrows(IllegalStateException.class, () -> store.insertInstance(instance));
    }

    @Test
    void updateInstance_ExistingInstance_ReplacesRecord() {
        // Given
        WorkflowInstance instance = createTestInstance("upd-1");
        store.insertInstance(instance);

        // When
        store.updateInstance(instance.start(T1).atStep("dispatch", "technician"));

        // Then
        WorkflowInstance reloaded = store.findInstance(instance.id()).orElseThrow();
        assertEquals(WorkflowStatus.IN_PROGRESS, reloaded.status());
        assertEquals("dispatch", reloaded.currentStepId());
    }

    @Test
    void updateInstance_UnknownInstance_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> store.updateInstance(createTestInstance("ghost")));
    }

    @Test
    void findInstance_UnknownId_ReturnsEmpty() {
        assertTrue(store.findInstance(InstanceId.of("missing")).isEmpty());
    }

    @Test
    void insertInstance_Null_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> store.insertInstance(null));
    }

    // ===== Step records =====

    @Test
    void insertStep_ListedByInstanceInInsertionOrder() {
        // Given
        InstanceId instanceId = InstanceId.of("steps-1");
        StepRecord first = createTestStepRecord(instanceId, "a");
        StepRecord second = createTestStepRecord(instanceId, "b");
        StepRecord other = createTestStepRecord(InstanceId.of("steps-2"), "a");

        // When
        store.insertStep(first);
        store.insertStep(other);
        store.insertStep(second);

        // Then
        List<StepRecord> records = store.findStepsByInstance(instanceId);
        assertEquals(List.of("a", "b"), records.stream().map(StepRecord::stepId).toList());
    }

    @Test
    void updateStep_ReplacesRecordInPlace() {
        // Given
        StepRecord record = createTestStepRecord(InstanceId.of("steps-3"), "a");
        store.insertStep(record);

        // When
        store.updateStep(record.finish(StepStatus.COMPLETED, Value.of("ok"), T1));

        // Then
        StepRecord reloaded = store.findStep(record.recordId()).orElseThrow();
        assertEquals(StepStatus.COMPLETED, reloaded.status());
        assertEquals(Value.of("ok"), reloaded.result());
        assertEquals(1, store.findStepsByInstance(record.instanceId()).size());
    }

    @Test
    void insertStep_DuplicateRecord_ThrowsIllegalState() {
        StepRecord record = createTestStepRecord(InstanceId.of("steps-5"), "a");
        store.insertStep(record);

        assertThrows(IllegalStateException.class, () -> store.insertStep(record));
        assertEquals(1, store.findStepsByInstance(record.instanceId()).size());
    }

    @Test
    void updateStep_UnknownRecord_ThrowsException() {
        assertThrows(IllegalStateException.class,
            () -> store.updateStep(createTestStepRecord(InstanceId.of("steps-4"), "a")));
    }

    @Test
    void findStepsByInstance_UnknownInstance_ReturnsEmptyList() {
        assertTrue(store.findStepsByInstance(InstanceId.of("none")).isEmpty());
    }

    // ===== Messages =====

    @Test
    void insertMessage_ThenUpdateDeliveryStatus() {
        // Given
        Message message = createTestMessage();
        store.insertMessage(message);

        // When
        store.updateMessage(message.withStatus(DeliveryStatus.DELIVERED));

        // Then
        Message reloaded = store.findMessage(message.id()).orElseThrow();
        assertEquals(DeliveryStatus.DELIVERED, reloaded.status());
        assertEquals("Action required", reloaded.subject());
    }

    @Test
    void updateMessage_UnknownMessage_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> store.updateMessage(createTestMessage()));
    }

    @Test
    void findMessage_UnknownId_ReturnsEmpty() {
        assertTrue(store.findMessage(MessageId.random()).isEmpty());
    }
}
