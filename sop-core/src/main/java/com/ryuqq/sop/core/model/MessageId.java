package com.ryuqq.sop.core.model;

import java.util.UUID;

/**
 * Role 간 메시지의 고유 식별자.
 *
 * <p>{@code MessageBus.send()}가 메시지를 영속화한 뒤 반환하는 값입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageId {

    private final String value;

    private MessageId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("MessageId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * MessageId 생성.
     *
     * @param value MessageId 값
     * @return MessageId 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static MessageId of(String value) {
        return new MessageId(value);
    }

    /**
     * UUID 기반 신규 MessageId 생성.
     *
     * @return 새 MessageId
     */
    public static MessageId random() {
        return new MessageId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MessageId messageId = (MessageId) o;
        return value.equals(messageId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "MessageId{" + value + '}';
    }
}
