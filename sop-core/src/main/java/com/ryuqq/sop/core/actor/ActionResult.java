package com.ryuqq.sop.core.actor;

import com.ryuqq.sop.core.model.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Role Actor의 action 실행 결과.
 *
 * <p>{@code completed=false}는 오류가 아닌 정상 결과입니다 (예: 에스컬레이션 후 미완료 보고).
 * 완료 여부는 completion criteria 평가에 사용됩니다.</p>
 *
 * @param completed action 완료 여부
 * @param output action 출력
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActionResult(boolean completed, Value output) {

    public ActionResult {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
    }

    public static ActionResult completed(Value output) {
        return new ActionResult(true, output);
    }

    public static ActionResult incomplete(Value output) {
        return new ActionResult(false, output);
    }

    /**
     * Step 출력 Map의 항목 형태로 변환.
     *
     * @return {@code {completed, output}}
     */
    public Value.MapValue toValue() {
        Map<String, Value> entries = new LinkedHashMap<>();
        entries.put("completed", Value.of(completed));
        entries.put("output", output);
        return Value.map(entries);
    }
}
