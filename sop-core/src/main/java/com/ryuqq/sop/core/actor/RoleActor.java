package com.ryuqq.sop.core.actor;

import com.ryuqq.sop.core.message.Message;

/**
 * Role 단위 비즈니스 로직 플러그인 인터페이스.
 *
 * <p>엔진은 Role Actor의 내부 구현을 알지 못하며, 이 계약만으로 action 실행,
 * 결정, 메시지 수신을 위임합니다. 구현체는 Step 타임아웃 내에 반환해야 하며,
 * 타임아웃 시 호출 스레드가 interrupt됩니다.</p>
 *
 * <p><strong>구현 규칙:</strong></p>
 * <ul>
 *   <li>복구 불가능한 오류는 예외로 던짐 (Step 실패로 기록)</li>
 *   <li>에스컬레이션은 메시지를 보낸 뒤 {@code completed=false}를 반환</li>
 *   <li>여러 인스턴스에서 동시에 호출될 수 있으므로 thread-safe 해야 함</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RoleActor {

    /**
     * Automated Step의 action 하나를 실행.
     *
     * @param action action 이름
     * @param input 호출 입력
     * @return 실행 결과
     * @throws Exception 실행 실패 시
     */
    ActionResult executeAction(String action, ActorInput input) throws Exception;

    /**
     * Decision Step의 결정을 내림.
     *
     * <p>기본 구현은 결정을 지원하지 않습니다.</p>
     *
     * @param input 호출 입력
     * @return 결정
     * @throws Exception 결정 실패 시
     */
    default Decision makeDecision(ActorInput input) throws Exception {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not make decisions");
    }

    /**
     * Message Bus로부터 메시지 수신.
     *
     * <p>기본 구현은 메시지를 무시합니다.</p>
     *
     * @param message 수신 메시지
     */
    default void receiveMessage(Message message) {
    }
}
