package com.ryuqq.sop.core.exception;

/**
 * 영속 저장소 쓰기/읽기 실패.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PersistenceException extends WorkflowException {

    public static final String ERROR_CODE = "SOP-STORE";

    public PersistenceException(String message) {
        super(ERROR_CODE, message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
