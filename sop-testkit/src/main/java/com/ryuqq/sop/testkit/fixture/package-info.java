/**
 * Test fixtures: scripted role actors and ready-made SOP definitions.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.sop.testkit.fixture;
