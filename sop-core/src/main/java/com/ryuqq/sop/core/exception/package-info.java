/**
 * Workflow engine exception taxonomy.
 *
 * <h2>Exceptions</h2>
 * <ul>
 *   <li>{@link com.ryuqq.sop.core.exception.DefinitionException} - Missing or malformed SOP definition</li>
 *   <li>{@link com.ryuqq.sop.core.exception.NoActorException} - No role actor registered for an Automated/Decision step</li>
 *   <li>{@link com.ryuqq.sop.core.exception.StepExecutionException} - Role actor handler raised or step could not proceed</li>
 *   <li>{@link com.ryuqq.sop.core.exception.StepTimeoutException} - Step exceeded its deadline without a failure branch</li>
 *   <li>{@link com.ryuqq.sop.core.exception.PersistenceException} - Durable store operation failed</li>
 * </ul>
 *
 * <h2>Propagation Policy</h2>
 * <ul>
 *   <li>Step, actor and timeout errors abort the owning instance to FAILED</li>
 *   <li>Definition errors abort creation (no record) or start (instance FAILED)</li>
 *   <li>Persistence errors on step record writes are logged; on status transitions they propagate</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.exception;
