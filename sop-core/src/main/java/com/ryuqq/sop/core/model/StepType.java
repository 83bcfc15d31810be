package com.ryuqq.sop.core.model;

import com.ryuqq.sop.core.exception.DefinitionException;

/**
 * Step 유형.
 *
 * <p>엔진은 Step 유형에 따라 실행 방식을 분기합니다.</p>
 * <ul>
 *   <li>AUTOMATED: 담당 Role Actor가 action 목록을 순서대로 실행</li>
 *   <li>HUMAN_ACTION: 담당 Role에 알림을 보내고 외부 완료 신호를 대기</li>
 *   <li>DECISION: 담당 Role Actor에게 결정을 위임 (Actor가 없으면 HUMAN_ACTION처럼 동작)</li>
 *   <li>PARALLEL: next_steps를 동시에 실행하고 전부 성공해야 완료</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum StepType {

    AUTOMATED("automated"),
    HUMAN_ACTION("human_action"),
    DECISION("decision"),
    PARALLEL("parallel");

    private final String code;

    StepType(String code) {
        this.code = code;
    }

    /**
     * SOP 정의 문서에서 사용하는 코드 (예: human_action).
     *
     * @return 코드
     */
    public String getCode() {
        return code;
    }

    /**
     * 코드로 StepType 조회.
     *
     * @param code 코드 (대소문자 무시)
     * @return StepType
     * @throws DefinitionException 알 수 없는 코드인 경우
     */
    public static StepType fromCode(String code) {
        if (code != null) {
            for (StepType type : values()) {
                if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                    return type;
                }
            }
        }
        throw new DefinitionException("Unknown step type: " + code);
    }
}
