package com.ryuqq.sop.core.outcome;

import com.ryuqq.sop.core.model.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Step 실행 완료.
 *
 * <p>Automated Step의 출력은 action 이름 → {@code {completed, output}} Map이고,
 * Decision Step의 출력은 {@code {decision, reasoning}} Map입니다.</p>
 *
 * @param satisfied completion criteria 충족 여부
 * @param output Step 출력
 * @param completedAt 완료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Completed(
    boolean satisfied,
    Value output,
    Instant completedAt
) implements StepResult {

    public static final String DECISION_KEY = "decision";
    public static final String REASONING_KEY = "reasoning";

    public Completed {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        if (completedAt == null) {
            throw new IllegalArgumentException("completedAt cannot be null");
        }
    }

    public static Completed satisfied(Value output, Instant completedAt) {
        return new Completed(true, output, completedAt);
    }

    /**
     * Decision 출력에서 decision 값 추출.
     *
     * @return decision 값 (출력이 Map이 아니거나 키가 없으면 empty)
     */
    public Optional<Value> decision() {
        if (output instanceof Value.MapValue map) {
            return map.get(DECISION_KEY);
        }
        return Optional.empty();
    }

    @Override
    public Value toValue() {
        return output;
    }
}
