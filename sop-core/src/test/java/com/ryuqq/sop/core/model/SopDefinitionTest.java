package com.ryuqq.sop.core.model;

import com.ryuqq.sop.core.exception.DefinitionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SopDefinition 불변식 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class SopDefinitionTest {

    private static WorkflowStep step(String id, String... next) {
        return WorkflowStep.builder(id, StepType.AUTOMATED)
            .assignedRole("operator")
            .nextSteps(next)
            .build();
    }

    @Test
    void constructor_ValidGraph_CreatesDefinition() {
        // When
        SopDefinition definition = new SopDefinition("sop", "desc",
            List.of(step("a", "b"), step("b")), List.of("operator"), List.of("manager"), null);

        // Then
        assertEquals(2, definition.steps().size());
        assertEquals(List.of("operator"), definition.requiredRoles());
    }

    @Test
    void constructor_NoSteps_ThrowsDefinitionException() {
        DefinitionException exception = assertThrows(DefinitionException.class,
            () -> new SopDefinition("sop", null, List.of(), null, null, null));
        assertEquals("SOP-DEF", exception.getErrorCode());
    }

    @Test
    void constructor_DuplicateStepIds_ThrowsDefinitionException() {
        DefinitionException exception = assertThrows(DefinitionException.class,
            () -> new SopDefinition("sop", null, List.of(step("a"), step("a")), null, null, null));
        assertTrue(exception.getMessage().contains("duplicate step id: a"));
    }

    @Test
    void constructor_UnknownNextStep_ThrowsDefinitionException() {
        DefinitionException exception = assertThrows(DefinitionException.class,
            () -> new SopDefinition("sop", null, List.of(step("a", "ghost")), null, null, null));
        assertTrue(exception.getMessage().contains("ghost"));
    }

    @Test
    void constructor_UnknownConditionTarget_ThrowsDefinitionException() {
        // Given
        WorkflowStep decide = WorkflowStep.builder("decide", StepType.DECISION)
            .assignedRole("supervisor")
            .condition("decision:approve", "missing")
            .build();

        // When & Then
        assertThrows(DefinitionException.class,
            () -> new SopDefinition("sop", null, List.of(decide), null, null, null));
    }

    @Test
    void dueAt_WithTimeLimit_AddsLimitToStart() {
        // Given
        SopDefinition definition = new SopDefinition("sop", null, List.of(step("a")), null, null,
            Duration.ofHours(4));
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        // When & Then
        assertEquals(Instant.parse("2024-01-01T04:00:00Z"), definition.dueAt(start).orElseThrow());
    }

    @Test
    void dueAt_WithoutTimeLimit_ReturnsEmpty() {
        SopDefinition definition = new SopDefinition("sop", null, List.of(step("a")), null, null, null);
        assertTrue(definition.dueAt(Instant.now()).isEmpty());
    }
}
