/**
 * Workflow instance and step record state machines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.statemachine.WorkflowStatus} - Workflow instance lifecycle states</li>
 *   <li>{@link com.ryuqq.sop.core.statemachine.StepStatus} - Step execution record states</li>
 *   <li>{@link com.ryuqq.sop.core.statemachine.StateTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Workflow Transition Rules</h2>
 * <pre>
 * PENDING → IN_PROGRESS | FAILED | CANCELLED
 * IN_PROGRESS → COMPLETED | FAILED | CANCELLED
 *
 * Forbidden:
 * - COMPLETED, FAILED, CANCELLED → * (terminal states)
 * - Backward transitions (e.g., IN_PROGRESS → PENDING)
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * WorkflowStatus status = WorkflowStatus.PENDING;
 * status = StateTransition.transition(status, WorkflowStatus.IN_PROGRESS);
 * status = StateTransition.transition(status, WorkflowStatus.COMPLETED);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(status, WorkflowStatus.IN_PROGRESS);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.statemachine;
