/**
 * Inter-role messages exchanged through the {@link com.ryuqq.sop.core.spi.MessageBus}.
 *
 * <p>A {@link com.ryuqq.sop.core.message.MessageDraft} is what a sender submits;
 * the bus assigns an id and timestamp, persists the resulting
 * {@link com.ryuqq.sop.core.message.Message} and records its
 * {@link com.ryuqq.sop.core.message.DeliveryStatus}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.message;
