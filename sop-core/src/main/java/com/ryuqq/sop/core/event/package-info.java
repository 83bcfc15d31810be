/**
 * Workflow lifecycle events and handler hooks.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.event;
