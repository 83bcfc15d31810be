package com.ryuqq.sop.application.orchestrator;

import com.ryuqq.sop.core.model.Value;

import java.util.Map;

/**
 * 대기 중인 Human Action Step에 대한 담당자 응답.
 *
 * <p>Decision Step의 사람 대체 처리에서는 {@code output}의 {@code decision} 항목이
 * 조건 평가에 사용됩니다.</p>
 *
 * @param completed 작업 완료 여부 (false이면 failure 분기)
 * @param output 응답 데이터
 * @param respondedBy 응답자 (nullable)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record HumanTaskResponse(boolean completed, Value output, String respondedBy) {

    public HumanTaskResponse {
        output = output == null ? Value.emptyMap() : output;
    }

    public static HumanTaskResponse completed(Value output) {
        return new HumanTaskResponse(true, output, null);
    }

    public static HumanTaskResponse notCompleted(Value output) {
        return new HumanTaskResponse(false, output, null);
    }

    /**
     * 사람이 내린 결정으로 응답.
     *
     * @param decision 결정 값
     * @param respondedBy 응답자
     * @return HumanTaskResponse
     */
    public static HumanTaskResponse decided(String decision, String respondedBy) {
        return new HumanTaskResponse(true, Value.map(Map.of("decision", Value.of(decision))), respondedBy);
    }
}
