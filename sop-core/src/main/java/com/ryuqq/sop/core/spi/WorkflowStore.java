package com.ryuqq.sop.core.spi;

import com.ryuqq.sop.core.exception.PersistenceException;
import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.record.StepRecord;
import com.ryuqq.sop.core.record.WorkflowInstance;

import java.util.List;
import java.util.Optional;

/**
 * Persistent Storage SPI for workflow instances, step records and messages.
 *
 * <p>The engine writes through this interface before it treats a state change
 * as committed. Only id lookups are required; the engine never issues range queries
 * apart from listing the step records of one instance.</p>
 *
 * <p><strong>Write Ordering:</strong></p>
 * <pre>
 * 1. insertInstance(PENDING)          → createInstance
 * 2. updateInstance(IN_PROGRESS)      → start
 * 3. insertStep(IN_PROGRESS)          → before each step is dispatched
 * 4. updateStep(COMPLETED / FAILED …) → before the result is stored in the context
 * 5. updateInstance(terminal state)   → completion, failure or cancellation
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: parallel branches write step records concurrently</li>
 *   <li>Infrastructure failures (connection lost, write not durable) are reported as
 *       {@link PersistenceException}</li>
 *   <li>{@link IllegalStateException} is reserved for duplicate ids on insert and unknown ids on update</li>
 * </ul>
 *
 * <p>The engine propagates a {@link PersistenceException} from an instance write and logs and
 * continues on one from a step-record write. Any other exception from a step-record write
 * fails the instance.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface WorkflowStore {

    /**
     * Inserts a new workflow instance.
     *
     * @param instance the instance record
     * @throws IllegalArgumentException if instance is null
     * @throws IllegalStateException if an instance with the same id already exists
     * @throws PersistenceException if the write could not be made durable
     */
    void insertInstance(WorkflowInstance instance);

    /**
     * Replaces an existing workflow instance.
     *
     * @param instance the updated instance record
     * @throws IllegalArgumentException if instance is null
     * @throws IllegalStateException if the instance does not exist
     * @throws PersistenceException if the write could not be made durable
     */
    void updateInstance(WorkflowInstance instance);

    /**
     * Finds a workflow instance by id.
     *
     * @param instanceId the instance id
     * @return the instance, or empty if unknown
     */
    Optional<WorkflowInstance> findInstance(InstanceId instanceId);

    /**
     * Inserts a new step record.
     *
     * @param record the step record
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if a record with the same id already exists
     * @throws PersistenceException if the write could not be made durable
     */
    void insertStep(StepRecord record);

    /**
     * Replaces an existing step record.
     *
     * @param record the updated step record
     * @throws IllegalArgumentException if record is null
     * @throws IllegalStateException if the record does not exist
     * @throws PersistenceException if the write could not be made durable
     */
    void updateStep(StepRecord record);

    /**
     * Finds a step record by its record id.
     *
     * @param recordId the record id
     * @return the record, or empty if unknown
     */
    Optional<StepRecord> findStep(String recordId);

    /**
     * Lists the step records of one instance in insertion order.
     *
     * @param instanceId the instance id
     * @return step records (may be empty)
     */
    List<StepRecord> findStepsByInstance(InstanceId instanceId);

    /**
     * Inserts a new message.
     *
     * @param message the message
     * @throws IllegalArgumentException if message is null
     * @throws IllegalStateException if a message with the same id already exists
     * @throws PersistenceException if the write could not be made durable
     */
    void insertMessage(Message message);

    /**
     * Replaces an existing message (delivery status changes).
     *
     * @param message the updated message
     * @throws IllegalArgumentException if message is null
     * @throws IllegalStateException if the message does not exist
     * @throws PersistenceException if the write could not be made durable
     */
    void updateMessage(Message message);

    /**
     * Finds a message by id.
     *
     * @param messageId the message id
     * @return the message, or empty if unknown
     */
    Optional<Message> findMessage(MessageId messageId);
}
