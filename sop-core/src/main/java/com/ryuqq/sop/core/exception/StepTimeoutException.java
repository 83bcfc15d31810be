package com.ryuqq.sop.core.exception;

import java.time.Duration;

/**
 * Step이 deadline을 넘겨 TIMED_OUT 처리된 뒤 이를 받아줄 failure 분기가 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StepTimeoutException extends WorkflowException {

    public static final String ERROR_CODE = "SOP-TIMEOUT";

    private final String stepId;
    private final Duration timeout;

    public StepTimeoutException(String stepId, Duration timeout) {
        super(ERROR_CODE, "Step " + stepId + " timed out after " + timeout.toMillis() + "ms");
        this.stepId = stepId;
        this.timeout = timeout;
    }

    public String getStepId() {
        return stepId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
