package com.ryuqq.sop.adapter.inmemory.store;

import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.record.StepRecord;
import com.ryuqq.sop.core.record.WorkflowInstance;
import com.ryuqq.sop.core.spi.WorkflowStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link WorkflowStore} SPI for testing and reference purposes.
 *
 * <p>This implementation keeps every record in {@link ConcurrentHashMap}s keyed by id and
 * tracks the step records of each instance in a {@link CopyOnWriteArrayList} so that
 * concurrent parallel branches can insert without external locking.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>instances:</strong> ConcurrentHashMap&lt;InstanceId, WorkflowInstance&gt;</li>
 *   <li><strong>steps:</strong> ConcurrentHashMap&lt;String, StepRecord&gt; keyed by record id</li>
 *   <li><strong>stepIndex:</strong> ConcurrentHashMap&lt;InstanceId, CopyOnWriteArrayList&lt;String&gt;&gt; record ids in insertion order</li>
 *   <li><strong>messages:</strong> ConcurrentHashMap&lt;MessageId, Message&gt;</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * WorkflowStore store = new InMemoryWorkflowStore();
 * store.insertInstance(WorkflowInstance.pending(id, "maintenance", "work_order", "WO-1", data, now, null));
 * WorkflowInstance reloaded = store.findInstance(id).orElseThrow();
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryWorkflowStore implements WorkflowStore {

    private final ConcurrentHashMap<InstanceId, WorkflowInstance> instances = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StepRecord> steps = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<InstanceId, CopyOnWriteArrayList<String>> stepIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<MessageId, Message> messages = new ConcurrentHashMap<>();

    @Override
    public void insertInstance(WorkflowInstance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (instances.putIfAbsent(instance.id(), instance) != null) {
            throw new IllegalStateException("Instance already exists: " + instance.id());
        }
    }

    @Override
    public void updateInstance(WorkflowInstance instance) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (instances.replace(instance.id(), instance) == null) {
            throw new IllegalStateException("Instance not found: " + instance.id());
        }
    }

    @Override
    public Optional<WorkflowInstance> findInstance(InstanceId instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(instances.get(instanceId));
    }

    /**
     * {@inheritDoc}
     *
     * <p>The record id is appended to the owning instance's index only after the
     * record itself is visible, so listings never return dangling ids.</p>
     */
    @Override
    public void insertStep(StepRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (steps.putIfAbsent(record.recordId(), record) != null) {
            throw new IllegalStateException("Step record already exists: " + record.recordId());
        }
        stepIndex.computeIfAbsent(record.instanceId(), id -> new CopyOnWriteArrayList<>()).add(record.recordId());
    }

    @Override
    public void updateStep(StepRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (steps.replace(record.recordId(), record) == null) {
            throw new IllegalStateException("Step record not found: " + record.recordId());
        }
    }

    @Override
    public Optional<StepRecord> findStep(String recordId) {
        if (recordId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(steps.get(recordId));
    }

    @Override
    public List<StepRecord> findStepsByInstance(InstanceId instanceId) {
        List<String> recordIds = stepIndex.get(instanceId);
        if (recordIds == null) {
            return List.of();
        }
        List<StepRecord> records = new ArrayList<>(recordIds.size());
        for (String recordId : recordIds) {
            records.add(steps.get(recordId));
        }
        return List.copyOf(records);
    }

    @Override
    public void insertMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (messages.putIfAbsent(message.id(), message) != null) {
            throw new IllegalStateException("Message already exists: " + message.id());
        }
    }

    @Override
    public void updateMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (messages.replace(message.id(), message) == null) {
            throw new IllegalStateException("Message not found: " + message.id());
        }
    }

    @Override
    public Optional<Message> findMessage(MessageId messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(messages.get(messageId));
    }

    /**
     * All persisted messages, for test assertions.
     *
     * @return snapshot of messages (unordered)
     */
    public List<Message> allMessages() {
        return List.copyOf(messages.values());
    }

    /**
     * Clears all stored data.
     *
     * <p>Used for test isolation.</p>
     */
    public void clear() {
        instances.clear();
        steps.clear();
        stepIndex.clear();
        messages.clear();
    }
}
