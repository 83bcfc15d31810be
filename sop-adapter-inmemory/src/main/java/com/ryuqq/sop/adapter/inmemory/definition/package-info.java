/**
 * In-memory SOP definition registry.
 *
 * @see com.ryuqq.sop.core.spi.SopDefinitionSource
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.sop.adapter.inmemory.definition;
