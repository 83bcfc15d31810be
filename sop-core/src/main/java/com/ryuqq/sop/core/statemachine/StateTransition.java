package com.ryuqq.sop.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>Workflow 인스턴스와 Step 레코드의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 단조(monotonic) 전이 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이 (Workflow):</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS | FAILED | CANCELLED</li>
 *   <li>IN_PROGRESS → COMPLETED | FAILED | CANCELLED</li>
 * </ul>
 *
 * <p><strong>허용되는 전이 (Step):</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS | SKIPPED</li>
 *   <li>IN_PROGRESS → COMPLETED | FAILED | TIMED_OUT | SKIPPED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: IN_PROGRESS → PENDING)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Workflow 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(WorkflowStatus from, WorkflowStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == WorkflowStatus.IN_PROGRESS
                || to == WorkflowStatus.FAILED
                || to == WorkflowStatus.CANCELLED;
            case IN_PROGRESS -> to == WorkflowStatus.COMPLETED
                || to == WorkflowStatus.FAILED
                || to == WorkflowStatus.CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Step 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(StepStatus from, StepStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal step state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == StepStatus.IN_PROGRESS || to == StepStatus.SKIPPED;
            case IN_PROGRESS -> to != StepStatus.PENDING && to != StepStatus.IN_PROGRESS;
            case COMPLETED, FAILED, SKIPPED, TIMED_OUT -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid step state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * Workflow 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static WorkflowStatus transition(WorkflowStatus current, WorkflowStatus next) {
        validate(current, next);
        return next;
    }

    /**
     * Step 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static StepStatus transition(StepStatus current, StepStatus next) {
        validate(current, next);
        return next;
    }
}
