/**
 * SOP definition model and value types.
 *
 * <p>This package defines the immutable, read-only description of a Standard
 * Operating Procedure and the closed value type used for workflow data.</p>
 *
 * <h2>Definition Model</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.model.SopDefinition} - Ordered steps, required roles, escalation chain, time limit</li>
 *   <li>{@link com.ryuqq.sop.core.model.WorkflowStep} - One node of the step graph</li>
 *   <li>{@link com.ryuqq.sop.core.model.StepType} - AUTOMATED, HUMAN_ACTION, DECISION, PARALLEL</li>
 *   <li>{@link com.ryuqq.sop.core.model.StepCondition} - Typed branch condition (success, failure, decision:&lt;value&gt;)</li>
 *   <li>{@link com.ryuqq.sop.core.model.ConditionalBranch} - Condition paired with its target step id</li>
 *   <li>{@link com.ryuqq.sop.core.model.CompletionCriteria} - Named completion predicates</li>
 * </ul>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.model.Value} - Closed union for trigger data, step output and message data</li>
 *   <li>{@link com.ryuqq.sop.core.model.InstanceId} - Workflow instance identifier</li>
 *   <li>{@link com.ryuqq.sop.core.model.MessageId} - Actor message identifier</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Definitions never change after loading</li>
 *   <li><strong>Validation:</strong> Graph integrity is checked when a definition is constructed</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.model;
