package com.ryuqq.sop.core.exception;

/**
 * SOP 정의를 찾을 수 없거나 형식이 잘못된 경우.
 *
 * <p>인스턴스 생성 시점에 발생하면 인스턴스 레코드가 만들어지지 않고,
 * 시작 시점에 발생하면 이미 생성된 인스턴스가 FAILED로 종료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefinitionException extends WorkflowException {

    public static final String ERROR_CODE = "SOP-DEF";

    public DefinitionException(String message) {
        super(ERROR_CODE, message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
