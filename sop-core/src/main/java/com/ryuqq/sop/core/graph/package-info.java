/**
 * Step graph utilities: entry-step discovery and id lookup over an immutable SOP definition.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.core.graph;
