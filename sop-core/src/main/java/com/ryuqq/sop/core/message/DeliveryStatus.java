package com.ryuqq.sop.core.message;

/**
 * 메시지 전달 상태.
 *
 * <ul>
 *   <li>SENT: 저장됨, 아직 전달 전 (또는 수신 Actor 없음)</li>
 *   <li>DELIVERED: 수신 Actor가 정상 처리</li>
 *   <li>FAILED: 수신 Actor가 예외를 던짐</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum DeliveryStatus {
    SENT,
    DELIVERED,
    FAILED
}
