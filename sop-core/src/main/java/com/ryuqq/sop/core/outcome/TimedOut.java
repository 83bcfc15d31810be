package com.ryuqq.sop.core.outcome;

import com.ryuqq.sop.core.model.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step이 기한 내 결과를 내지 못함.
 *
 * <p>성공으로 간주되지 않으며 {@code failure} 조건으로 라우팅됩니다.</p>
 *
 * @param timeout 적용된 타임아웃
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TimedOut(Duration timeout) implements StepResult {

    public TimedOut {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
    }

    @Override
    public Value toValue() {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("timed_out", Value.of(true));
        entries.put("timeout_ms", Value.of(timeout.toMillis()));
        return Value.map(entries);
    }
}
