package com.ryuqq.sop.core.exception;

/**
 * 워크플로우 엔진 예외의 최상위 타입.
 *
 * <p>모든 하위 예외는 안정적인 오류 코드({@link #getErrorCode()})를 가지며,
 * 인스턴스 레코드에는 스택 트레이스 대신 오류 메시지만 기록됩니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>SOP-DEF: {@link DefinitionException}</li>
 *   <li>SOP-ACTOR: {@link NoActorException}</li>
 *   <li>SOP-STEP: {@link StepExecutionException}</li>
 *   <li>SOP-TIMEOUT: {@link StepTimeoutException}</li>
 *   <li>SOP-STORE: {@link PersistenceException}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class WorkflowException extends RuntimeException {

    private final String errorCode;

    protected WorkflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected WorkflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: SOP-DEF)
     */
    public String getErrorCode() {
        return errorCode;
    }
}
