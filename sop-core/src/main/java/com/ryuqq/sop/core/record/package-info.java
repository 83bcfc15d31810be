/**
 * Persisted records: workflow instances and per-execution step records.
 *
 * <p>Records are immutable; every status change goes through
 * {@link com.ryuqq.sop.core.statemachine.StateTransition} and yields a new record
 * that the caller writes back through {@link com.ryuqq.sop.core.spi.WorkflowStore}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.record;
