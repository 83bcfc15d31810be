package com.ryuqq.sop.adapter.inmemory.bus;

import com.ryuqq.sop.core.actor.ActorRegistry;
import com.ryuqq.sop.core.actor.RoleActor;
import com.ryuqq.sop.core.exception.PersistenceException;
import com.ryuqq.sop.core.message.DeliveryStatus;
import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.spi.MessageBus;
import com.ryuqq.sop.core.spi.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * In-process implementation of {@link MessageBus} SPI.
 *
 * <p>Messages are persisted through the {@link WorkflowStore} first and then delivered
 * synchronously, on the sender's thread, to the actor registered for the receiving role.</p>
 *
 * <p><strong>Delivery Status:</strong></p>
 * <ul>
 *   <li><strong>SENT:</strong> persisted, no actor registered for the receiving role</li>
 *   <li><strong>DELIVERED:</strong> receiving actor returned normally</li>
 *   <li><strong>FAILED:</strong> receiving actor threw; the failure is logged and not propagated</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessageBus bus = new InMemoryMessageBus(store, registry);
 * MessageId id = bus.send(MessageDraft.of("supervisor", "manager", MessageType.ESCALATION,
 *     "Overdue", "Repair exceeded its time limit"));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final WorkflowStore store;
    private final ActorRegistry registry;
    private final Clock clock;

    public InMemoryMessageBus(WorkflowStore store, ActorRegistry registry) {
        this(store, registry, Clock.systemUTC());
    }

    public InMemoryMessageBus(WorkflowStore store, ActorRegistry registry, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public MessageId send(MessageDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        Message message = draft.toMessage(MessageId.random(), clock.instant());
        persist(message);

        Optional<RoleActor> receiver = registry.find(message.toRole());
        if (receiver.isEmpty()) {
            log.debug("No actor registered for role {}, message {} stays SENT", message.toRole(), message.id());
            return message.id();
        }

        DeliveryStatus status = deliver(receiver.get(), message);
        try {
            store.updateMessage(message.withStatus(status));
        } catch (RuntimeException e) {
            log.warn("Failed to record delivery status {} for message {}", status, message.id(), e);
        }
        return message.id();
    }

    private void persist(Message message) {
        try {
            store.insertMessage(message);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to persist message " + message.id(), e);
        }
    }

    private DeliveryStatus deliver(RoleActor receiver, Message message) {
        try {
            receiver.receiveMessage(message);
            log.debug("Delivered {} message {} from {} to {}",
                message.type(), message.id(), message.fromRole(), message.toRole());
            return DeliveryStatus.DELIVERED;
        } catch (RuntimeException e) {
            log.warn("Role {} failed to receive message {}: {}", message.toRole(), message.id(), e.getMessage(), e);
            return DeliveryStatus.FAILED;
        }
    }
}
