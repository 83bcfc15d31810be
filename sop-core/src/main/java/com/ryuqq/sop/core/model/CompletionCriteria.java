package com.ryuqq.sop.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step 완료 판정 기준 (이름 있는 predicate 집합).
 *
 * <p>엔진이 이해하는 기준은 {@link #ALL_ACTIONS_COMPLETED}와 {@link #ANY_ACTION_COMPLETED}이며,
 * 그 외 키는 보존만 하고 평가 시 무시합니다. 값이 명시적으로 {@code false}인 기준은 비활성입니다.</p>
 *
 * @param entries 기준 이름 → 값 (선언 순서 유지)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CompletionCriteria(Map<String, Value> entries) {

    public static final String ALL_ACTIONS_COMPLETED = "all_actions_completed";
    public static final String ANY_ACTION_COMPLETED = "any_action_completed";

    private static final CompletionCriteria NONE = new CompletionCriteria(Map.of());

    public CompletionCriteria {
        if (entries == null) {
            throw new IllegalArgumentException("entries cannot be null");
        }
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * 기준 없음 (항상 충족).
     *
     * @return 빈 CompletionCriteria
     */
    public static CompletionCriteria none() {
        return NONE;
    }

    /**
     * 모든 action 완료 기준.
     *
     * @return all_actions_completed=true
     */
    public static CompletionCriteria allActionsCompleted() {
        return new CompletionCriteria(Map.of(ALL_ACTIONS_COMPLETED, Value.of(true)));
    }

    /**
     * 하나 이상의 action 완료 기준.
     *
     * @return any_action_completed=true
     */
    public static CompletionCriteria anyActionCompleted() {
        return new CompletionCriteria(Map.of(ANY_ACTION_COMPLETED, Value.of(true)));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 기준이 선언되어 있고 활성 상태인지 확인.
     *
     * @param criterion 기준 이름
     * @return 활성 여부
     */
    public boolean isActive(String criterion) {
        Value value = entries.get(criterion);
        return value != null && value.isTruthy();
    }

    /**
     * Actor에게 전달할 Value 형태로 변환.
     *
     * @return MapValue
     */
    public Value.MapValue toValue() {
        return Value.map(entries);
    }
}
