/**
 * Step execution engine and workflow instance manager.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.adapter.runner.WorkflowInstanceManager} - implements
 *       {@link com.ryuqq.sop.application.orchestrator.WorkflowOrchestrator}: create, start, cancel,
 *       resume human steps</li>
 *   <li>{@link com.ryuqq.sop.adapter.runner.StepExecutionEngine} - explicit-stack graph traversal
 *       and per-type step dispatch</li>
 *   <li>{@link com.ryuqq.sop.adapter.runner.ExecutionLedger} - instance and step record writes</li>
 *   <li>{@link com.ryuqq.sop.adapter.runner.HumanTaskCoordinator} - suspended human steps</li>
 *   <li>{@link com.ryuqq.sop.adapter.runner.WorkflowEventDispatcher} - event handler fan-out</li>
 *   <li>{@link com.ryuqq.sop.adapter.runner.EngineConfig} - timeouts, step budget, pool sizes</li>
 * </ul>
 *
 * <h2>Write Ordering</h2>
 * <p>Instance status transitions are persisted before they take effect and propagate
 * {@link com.ryuqq.sop.core.exception.PersistenceException}. Step record writes that fail are
 * logged and traversal continues.</p>
 *
 * <h2>Threading</h2>
 * <p>Traversals and parallel branches run on a cached traversal pool. Actor calls run on a
 * fixed action pool so that step timeouts can be enforced with {@code Future.get(timeout)}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.sop.adapter.runner;
