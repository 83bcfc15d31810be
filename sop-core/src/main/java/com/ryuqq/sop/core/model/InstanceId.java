package com.ryuqq.sop.core.model;

import java.util.UUID;

/**
 * Workflow Instance의 전역 고유 식별자.
 *
 * <p>InstanceId는 하나의 SOP 실행(Workflow Instance)을 추적하는 데 사용되며,
 * 영속 레코드(WorkflowInstance, StepRecord, Message)의 연결 키로 활용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InstanceId {

    private final String value;

    private InstanceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("InstanceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("InstanceId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("InstanceId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * InstanceId 생성.
     *
     * @param value InstanceId 값
     * @return InstanceId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static InstanceId of(String value) {
        return new InstanceId(value);
    }

    /**
     * UUID 기반 신규 InstanceId 생성.
     *
     * @return 새 InstanceId
     */
    public static InstanceId random() {
        return new InstanceId(UUID.randomUUID().toString());
    }

    /**
     * InstanceId 값 조회.
     *
     * @return InstanceId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InstanceId that = (InstanceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "InstanceId{" + value + '}';
    }
}
