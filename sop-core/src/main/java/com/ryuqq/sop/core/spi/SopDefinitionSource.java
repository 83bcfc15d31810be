package com.ryuqq.sop.core.spi;

import com.ryuqq.sop.core.model.SopDefinition;

/**
 * SOP definition lookup SPI.
 *
 * <p>Implementations may be backed by an in-memory registry, JSON documents
 * or any other source. Definitions are read-only once returned.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SopDefinitionSource {

    /**
     * Resolves a definition by SOP name.
     *
     * @param sopName the SOP name
     * @return the definition
     * @throws com.ryuqq.sop.core.exception.DefinitionException if the definition is unknown or malformed
     */
    SopDefinition load(String sopName);
}
