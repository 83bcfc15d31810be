package com.ryuqq.sop.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StepCondition 해석 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class StepConditionTest {

    @Test
    void parse_Success_ReturnsSuccess() {
        assertInstanceOf(StepCondition.Success.class, StepCondition.parse("success"));
    }

    @Test
    void parse_FailureWithWhitespace_ReturnsFailure() {
        assertInstanceOf(StepCondition.Failure.class, StepCondition.parse("  failure "));
    }

    @Test
    void parse_DecisionPrefix_ReturnsDecisionEqualsWithValue() {
        // When
        StepCondition condition = StepCondition.parse("decision:approve");

        // Then
        StepCondition.DecisionEquals decision = assertInstanceOf(StepCondition.DecisionEquals.class, condition);
        assertEquals("approve", decision.value());
        assertEquals("decision:approve", condition.expression());
    }

    @Test
    void parse_DecisionPrefixWithoutValue_ReturnsUnrecognized() {
        assertInstanceOf(StepCondition.Unrecognized.class, StepCondition.parse("decision:"));
    }

    @Test
    void parse_FreeFormCondition_ReturnsUnrecognizedKeepingRawText() {
        // When
        StepCondition condition = StepCondition.parse("safety_risk");

        // Then
        StepCondition.Unrecognized unrecognized = assertInstanceOf(StepCondition.Unrecognized.class, condition);
        assertEquals("safety_risk", unrecognized.raw());
        assertEquals("safety_risk", condition.expression());
    }

    @Test
    void parse_Blank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> StepCondition.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> StepCondition.parse(null));
    }
}
