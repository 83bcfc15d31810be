package com.ryuqq.sop.adapter.inmemory.definition;

import com.ryuqq.sop.core.exception.DefinitionException;
import com.ryuqq.sop.core.model.SopDefinition;
import com.ryuqq.sop.core.spi.SopDefinitionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry implementation of {@link SopDefinitionSource}.
 *
 * <p>Definitions are registered programmatically, keyed by SOP name.
 * Registering a definition under an existing name replaces it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySopDefinitionSource implements SopDefinitionSource {

    private static final Logger log = LoggerFactory.getLogger(InMemorySopDefinitionSource.class);

    private final ConcurrentHashMap<String, SopDefinition> definitions = new ConcurrentHashMap<>();

    public InMemorySopDefinitionSource register(SopDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (definitions.put(definition.name(), definition) != null) {
            log.info("Replaced SOP definition {}", definition.name());
        }
        return this;
    }

    @Override
    public SopDefinition load(String sopName) {
        SopDefinition definition = sopName == null ? null : definitions.get(sopName);
        if (definition == null) {
            throw new DefinitionException("Unknown SOP definition: " + sopName);
        }
        return definition;
    }

    public Set<String> names() {
        return Set.copyOf(definitions.keySet());
    }
}
