package com.ryuqq.sop.core.spi;

import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.model.MessageId;

/**
 * Message Bus SPI for role-to-role messages.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Assigning an id and timestamp to each draft</li>
 *   <li>Persisting the message before delivery</li>
 *   <li>Delivering synchronously to the receiver role's actor, if one is registered</li>
 *   <li>Recording the delivery status (SENT, DELIVERED, FAILED)</li>
 * </ul>
 *
 * <p>A failure inside the receiving actor is never propagated to the sender.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface MessageBus {

    /**
     * Persists and delivers a message.
     *
     * @param draft the message to send
     * @return the id assigned to the persisted message
     * @throws IllegalArgumentException if draft is null
     * @throws com.ryuqq.sop.core.exception.PersistenceException if the message cannot be persisted
     */
    MessageId send(MessageDraft draft);
}
