package com.ryuqq.sop.core.exception;

/**
 * Automated/Decision Step의 담당 Role에 등록된 Actor가 없는 경우.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class NoActorException extends WorkflowException {

    public static final String ERROR_CODE = "SOP-ACTOR";

    private final String role;

    public NoActorException(String role) {
        super(ERROR_CODE, "No actor registered for role: " + role);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
