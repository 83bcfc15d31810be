/**
 * Pure evaluation of step results.
 *
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.evaluation.ConditionEvaluator} - Chooses the next step ids from a step and its result</li>
 *   <li>{@link com.ryuqq.sop.core.evaluation.CompletionCriteriaChecker} - Decides whether action results satisfy the completion criteria</li>
 * </ul>
 *
 * <p>Both components are stateless and deterministic.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.evaluation;
