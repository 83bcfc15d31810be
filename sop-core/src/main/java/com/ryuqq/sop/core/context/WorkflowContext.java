package com.ryuqq.sop.core.context;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.outcome.Completed;
import com.ryuqq.sop.core.outcome.StepResult;
import com.ryuqq.sop.core.record.WorkflowInstance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실행 중인 인스턴스 하나의 인메모리 상태.
 *
 * <p>엔진이 인스턴스 생명주기 동안 소유하며, 종료 상태에 도달하면 활성 테이블에서 제거됩니다.
 * Parallel 분기가 동시에 결과를 기록하므로 모든 변경 연산은 thread-safe 합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>completedSteps는 추가만 가능 (Completed 결과가 기록될 때)</li>
 *   <li>cancelled 플래그는 한 번 설정되면 해제되지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowContext {

    private final InstanceId instanceId;
    private final String triggerType;
    private final String triggerId;
    private final Value.MapValue data;
    private final Map<String, StepResult> stepResults = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<String> completedSteps = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger stepExecutions = new AtomicInteger();
    private volatile String currentStepId;

    public WorkflowContext(InstanceId instanceId, String triggerType, String triggerId, Value.MapValue data) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        this.instanceId = instanceId;
        this.triggerType = triggerType;
        this.triggerId = triggerId;
        this.data = data == null ? Value.emptyMap() : data;
    }

    /**
     * 영속 레코드로부터 컨텍스트 재구성.
     *
     * @param instance 인스턴스 레코드
     * @return 새 컨텍스트 (Step 결과 없음)
     */
    public static WorkflowContext fromInstance(WorkflowInstance instance) {
        return new WorkflowContext(instance.id(), instance.triggerType(), instance.triggerId(),
            instance.initialContext());
    }

    public InstanceId instanceId() {
        return instanceId;
    }

    public String triggerType() {
        return triggerType;
    }

    public String triggerId() {
        return triggerId;
    }

    public Value.MapValue data() {
        return data;
    }

    /**
     * Step 결과 기록.
     *
     * @param stepId Step ID
     * @param result 결과
     */
    public void recordResult(String stepId, StepResult result) {
        stepResults.put(stepId, result);
        if (result instanceof Completed) {
            completedSteps.add(stepId);
        }
    }

    /**
     * 현재까지의 Step 결과 스냅샷.
     *
     * @return Step ID → 결과 (기록 순서)
     */
    public Map<String, StepResult> stepResults() {
        synchronized (stepResults) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(stepResults));
        }
    }

    public List<String> completedSteps() {
        return List.copyOf(completedSteps);
    }

    public String currentStepId() {
        return currentStepId;
    }

    public void setCurrentStepId(String currentStepId) {
        this.currentStepId = currentStepId;
    }

    /**
     * 취소 표시.
     *
     * @return 이번 호출로 처음 취소된 경우 true
     */
    public boolean markCancelled() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Step 실행 횟수 증가.
     *
     * @return 증가 후 실행 횟수
     */
    public int incrementStepExecutions() {
        return stepExecutions.incrementAndGet();
    }

    public int stepExecutions() {
        return stepExecutions.get();
    }
}
