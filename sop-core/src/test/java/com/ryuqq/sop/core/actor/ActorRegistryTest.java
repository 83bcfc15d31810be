package com.ryuqq.sop.core.actor;

import com.ryuqq.sop.core.model.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ActorRegistry 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ActorRegistryTest {

    private static final RoleActor NOOP = (action, input) -> ActionResult.completed(Value.nullValue());

    @Test
    void register_NewRole_IsFindable() {
        // Given
        ActorRegistry registry = new ActorRegistry();

        // When
        registry.register("technician", NOOP);

        // Then
        assertTrue(registry.isRegistered("technician"));
        assertSame(NOOP, registry.find("technician").orElseThrow());
    }

    @Test
    void register_ExistingRole_ReplacesAndReturnsPrevious() {
        // Given
        ActorRegistry registry = new ActorRegistry();
        RoleActor replacement = (action, input) -> ActionResult.incomplete(Value.nullValue());
        registry.register("technician", NOOP);

        // When
        RoleActor previous = registry.register("technician", replacement).orElseThrow();

        // Then
        assertSame(NOOP, previous);
        assertSame(replacement, registry.find("technician").orElseThrow());
    }

    @Test
    void find_UnknownOrNullRole_ReturnsEmpty() {
        ActorRegistry registry = new ActorRegistry();

        assertTrue(registry.find("nobody").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void register_BlankRole_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ActorRegistry().register(" ", NOOP));
    }

    @Test
    void makeDecision_DefaultImplementation_IsUnsupported() {
        assertThrows(UnsupportedOperationException.class, () -> NOOP.makeDecision(null));
    }
}
