package com.ryuqq.sop.adapter.inmemory.bus;

import com.ryuqq.sop.adapter.inmemory.store.InMemoryWorkflowStore;
import com.ryuqq.sop.core.actor.ActorRegistry;
import com.ryuqq.sop.core.exception.PersistenceException;
import com.ryuqq.sop.core.message.DeliveryStatus;
import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.message.MessageType;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.spi.WorkflowStore;
import com.ryuqq.sop.testkit.fixture.ScriptedRoleActor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * InMemoryMessageBus 테스트.
 *
 * <p>저장 후 전달 순서와 전달 상태 기록, 수신 실패 격리를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryMessageBusTest {

    private InMemoryWorkflowStore store;
    private ActorRegistry registry;
    private InMemoryMessageBus bus;

    @Mock
    private WorkflowStore failingStore;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkflowStore();
        registry = new ActorRegistry();
        bus = new InMemoryMessageBus(store, registry);
    }

    private static MessageDraft escalation() {
        return MessageDraft.of("supervisor", "manager", MessageType.ESCALATION, "Overdue", "Repair is overdue")
            .withData(Value.map(Map.of("unit", Value.of("4B"))))
            .withInstanceId(InstanceId.of("inst-1"));
    }

    @Test
    void send_수신_Actor에게_전달되고_DELIVERED_기록() {
        // given
        ScriptedRoleActor manager = ScriptedRoleActor.completingAll();
        registry.register("manager", manager);

        // when
        MessageId id = bus.send(escalation());

        // then
        Message stored = store.findMessage(id).orElseThrow();
        assertThat(stored.status()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(stored.relatedInstance()).contains(InstanceId.of("inst-1"));
        assertThat(manager.receivedMessages()).hasSize(1);
        assertThat(manager.receivedMessages().get(0).subject()).isEqualTo("Overdue");
    }

    @Test
    void send_수신_Actor_없으면_SENT_유지() {
        // when
        MessageId id = bus.send(escalation());

        // then
        assertThat(store.findMessage(id).orElseThrow().status()).isEqualTo(DeliveryStatus.SENT);
    }

    @Test
    void send_수신_실패는_전파되지_않고_FAILED_기록() {
        // given
        registry.register("manager", ScriptedRoleActor.completingAll()
            .failOnMessage(new IllegalStateException("inbox full")));

        // when
        MessageId id = bus.send(escalation());

        // then
        assertThat(store.findMessage(id).orElseThrow().status()).isEqualTo(DeliveryStatus.FAILED);
    }

    @Test
    void send_저장_실패시_PersistenceException_및_전달_안함() {
        // given
        ScriptedRoleActor manager = ScriptedRoleActor.completingAll();
        registry.register("manager", manager);
        InMemoryMessageBus brokenBus = new InMemoryMessageBus(failingStore, registry);
        doThrow(new IllegalStateException("disk full")).when(failingStore).insertMessage(any());

        // when & then
        assertThatThrownBy(() -> brokenBus.send(escalation()))
            .isInstanceOf(PersistenceException.class)
            .hasMessageContaining("Failed to persist message");
        assertThat(manager.receivedMessages()).isEmpty();
        verify(failingStore, never()).updateMessage(any());
    }

    @Test
    void send_null이면_예외() {
        assertThatThrownBy(() -> bus.send(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
