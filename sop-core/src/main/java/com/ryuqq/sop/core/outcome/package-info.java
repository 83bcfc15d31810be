/**
 * Step execution results.
 *
 * <h2>Result Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.outcome.StepResult} - Sealed result of one step execution</li>
 *   <li>{@link com.ryuqq.sop.core.outcome.Completed} - Step finished; carries criteria satisfaction and output</li>
 *   <li>{@link com.ryuqq.sop.core.outcome.Failed} - Step raised; carries the error text</li>
 *   <li>{@link com.ryuqq.sop.core.outcome.TimedOut} - No result before the step deadline</li>
 * </ul>
 *
 * <h2>Routing</h2>
 * <ul>
 *   <li>{@code success}: Completed with satisfied criteria</li>
 *   <li>{@code failure}: every other result, TimedOut included</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.outcome;
