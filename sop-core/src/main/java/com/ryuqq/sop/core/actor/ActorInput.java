package com.ryuqq.sop.core.actor;

import com.ryuqq.sop.core.model.CompletionCriteria;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.outcome.StepResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Role Actor 호출 시 전달되는 입력.
 *
 * <p>인스턴스의 트리거 데이터, 호출 시점까지의 이전 Step 결과 스냅샷,
 * 그리고 현재 Step 설정을 함께 전달합니다.</p>
 *
 * @param instanceId 인스턴스 ID
 * @param data 트리거 입력 데이터
 * @param priorResults Step ID → 결과 (호출 시점 스냅샷)
 * @param step 현재 Step 설정
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ActorInput(
    InstanceId instanceId,
    Value.MapValue data,
    Map<String, StepResult> priorResults,
    WorkflowStep step
) {

    public ActorInput {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        data = data == null ? Value.emptyMap() : data;
        priorResults = priorResults == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(priorResults));
    }

    public CompletionCriteria criteria() {
        return step.completionCriteria();
    }
}
