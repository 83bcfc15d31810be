package com.ryuqq.sop.core.message;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.model.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * 저장된 Role 간 메시지.
 *
 * @param id 메시지 ID
 * @param fromRole 발신 Role
 * @param toRole 수신 Role
 * @param type 메시지 유형
 * @param subject 제목
 * @param body 본문
 * @param data 구조화 데이터
 * @param instanceId 관련 인스턴스 ID (nullable)
 * @param status 전달 상태
 * @param createdAt 생성 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Message(
    MessageId id,
    String fromRole,
    String toRole,
    MessageType type,
    String subject,
    String body,
    Value.MapValue data,
    InstanceId instanceId,
    DeliveryStatus status,
    Instant createdAt
) {

    public Message {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (fromRole == null || toRole == null) {
            throw new IllegalArgumentException("fromRole and toRole cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        subject = subject == null ? "" : subject;
        body = body == null ? "" : body;
        data = data == null ? Value.emptyMap() : data;
    }

    public Optional<InstanceId> relatedInstance() {
        return Optional.ofNullable(instanceId);
    }

    public Message withStatus(DeliveryStatus status) {
        return new Message(id, fromRole, toRole, type, subject, body, data, instanceId, status, createdAt);
    }
}
