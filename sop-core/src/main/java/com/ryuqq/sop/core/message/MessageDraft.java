package com.ryuqq.sop.core.message;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.model.Value;

import java.time.Instant;

/**
 * 전송 전 메시지 (ID와 생성 시각 미할당).
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * MessageDraft draft = MessageDraft.of("supervisor", "manager", MessageType.ESCALATION,
 *         "Overdue", "Repair is overdue")
 *     .withInstanceId(instanceId);
 * MessageId id = messageBus.send(draft);
 * </pre>
 *
 * @param fromRole 발신 Role
 * @param toRole 수신 Role
 * @param type 메시지 유형
 * @param subject 제목
 * @param body 본문
 * @param data 구조화 데이터
 * @param instanceId 관련 인스턴스 ID (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MessageDraft(
    String fromRole,
    String toRole,
    MessageType type,
    String subject,
    String body,
    Value.MapValue data,
    InstanceId instanceId
) {

    public MessageDraft {
        if (fromRole == null || fromRole.isBlank()) {
            throw new IllegalArgumentException("fromRole cannot be null or blank");
        }
        if (toRole == null || toRole.isBlank()) {
            throw new IllegalArgumentException("toRole cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
        data = data == null ? Value.emptyMap() : data;
    }

    public static MessageDraft of(String fromRole, String toRole, MessageType type, String subject, String body) {
        return new MessageDraft(fromRole, toRole, type, subject, body, Value.emptyMap(), null);
    }

    public MessageDraft withData(Value.MapValue data) {
        return new MessageDraft(fromRole, toRole, type, subject, body, data, instanceId);
    }

    public MessageDraft withInstanceId(InstanceId instanceId) {
        return new MessageDraft(fromRole, toRole, type, subject, body, data, instanceId);
    }

    /**
     * ID와 생성 시각을 할당해 SENT 상태의 메시지로 변환.
     *
     * @param id 메시지 ID
     * @param createdAt 생성 시각
     * @return Message
     */
    public Message toMessage(MessageId id, Instant createdAt) {
        return new Message(id, fromRole, toRole, type, subject, body, data, instanceId,
            DeliveryStatus.SENT, createdAt);
    }
}
