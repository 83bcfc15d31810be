package com.ryuqq.sop.core.actor;

import com.ryuqq.sop.core.model.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decision Step에서 Role Actor가 내린 결정.
 *
 * @param decision 결정 값 (조건 {@code decision:<value>}와 텍스트로 비교)
 * @param reasoning 결정 근거
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Decision(Value decision, Value reasoning) {

    public Decision {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
        reasoning = reasoning == null ? Value.nullValue() : reasoning;
    }

    public static Decision of(String decision, String reasoning) {
        return new Decision(Value.of(decision), reasoning == null ? Value.nullValue() : Value.of(reasoning));
    }

    /**
     * Step 출력 형태로 변환.
     *
     * @return {@code {decision, reasoning}}
     */
    public Value.MapValue toValue() {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("decision", decision);
        entries.put("reasoning", reasoning);
        return Value.map(entries);
    }
}
