/**
 * In-memory state of a running workflow instance.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.context;
