/**
 * Reusable contract tests for SPI implementations.
 *
 * <p>Adapters extend {@link com.ryuqq.sop.testkit.contract.AbstractWorkflowStoreContractTest}
 * to prove they honour the persistence contract the engine depends on.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.testkit.contract;
