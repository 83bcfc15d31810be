package com.ryuqq.sop.core.outcome;

import com.ryuqq.sop.core.model.Value;

import java.util.Map;

/**
 * Step 실행 실패.
 *
 * <p>스택 트레이스가 아닌 오류 메시지만 보관합니다.</p>
 *
 * @param error 오류 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(String error) implements StepResult {

    public Failed {
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
    }

    public static Failed of(String error) {
        return new Failed(error);
    }

    @Override
    public Value toValue() {
        return Value.map(Map.of("error", Value.of(error)));
    }
}
