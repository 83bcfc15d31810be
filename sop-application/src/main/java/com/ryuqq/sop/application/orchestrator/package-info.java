/**
 * Workflow orchestration port.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.application.orchestrator.WorkflowOrchestrator} - Create, start, cancel, resume and query instances</li>
 *   <li>{@link com.ryuqq.sop.application.orchestrator.WorkflowHandle} - Completion handle of a running traversal</li>
 *   <li>{@link com.ryuqq.sop.application.orchestrator.HumanTaskResponse} - External answer to a suspended human step</li>
 * </ul>
 *
 * <p>The engine implementation lives in {@code sop-adapter-runner}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.application.orchestrator;
