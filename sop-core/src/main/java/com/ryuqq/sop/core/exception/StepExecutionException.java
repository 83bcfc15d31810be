package com.ryuqq.sop.core.exception;

/**
 * Step 실행 중 Actor 핸들러가 예외를 던졌거나 Step을 계속 진행할 수 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepExecutionException extends WorkflowException {

    public static final String ERROR_CODE = "SOP-STEP";

    private final String stepId;

    public StepExecutionException(String stepId, String message) {
        super(ERROR_CODE, message);
        this.stepId = stepId;
    }

    public StepExecutionException(String stepId, String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
