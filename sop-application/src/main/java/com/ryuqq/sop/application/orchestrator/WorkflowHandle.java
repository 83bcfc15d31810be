package com.ryuqq.sop.application.orchestrator;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Workflow 인스턴스 실행 핸들.
 *
 * <p>{@link WorkflowOrchestrator#start(InstanceId)}가 반환하며, 순회가 종료 상태에
 * 도달하면 완료되는 future를 감쌉니다.</p>
 *
 * <p><strong>두 가지 생성 경로:</strong></p>
 * <ul>
 *   <li>{@link #started(InstanceId, CompletableFuture)}: 이번 호출로 순회가 시작됨</li>
 *   <li>{@link #alreadyRunning(InstanceId, CompletableFuture)}: 이미 실행 중인 순회의 핸들 (중복 실행 없음)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowHandle {

    private final InstanceId instanceId;
    private final boolean alreadyRunning;
    private final CompletableFuture<WorkflowStatus> completion;

    private WorkflowHandle(InstanceId instanceId, boolean alreadyRunning,
                           CompletableFuture<WorkflowStatus> completion) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        if (completion == null) {
            throw new IllegalArgumentException("completion cannot be null");
        }
        this.instanceId = instanceId;
        this.alreadyRunning = alreadyRunning;
        this.completion = completion;
    }

    public static WorkflowHandle started(InstanceId instanceId, CompletableFuture<WorkflowStatus> completion) {
        return new WorkflowHandle(instanceId, false, completion);
    }

    public static WorkflowHandle alreadyRunning(InstanceId instanceId, CompletableFuture<WorkflowStatus> completion) {
        return new WorkflowHandle(instanceId, true, completion);
    }

    public InstanceId getInstanceId() {
        return instanceId;
    }

    /**
     * 반복 start 호출로 얻은 핸들인지 확인.
     *
     * @return 이미 실행 중이던 순회의 핸들이면 true
     */
    public boolean isAlreadyRunning() {
        return alreadyRunning;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * 종료 상태까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 종료 상태 (COMPLETED, FAILED, CANCELLED)
     * @throws InterruptedException 대기 중 interrupt된 경우
     * @throws TimeoutException 시간 내 종료되지 않은 경우
     */
    public WorkflowStatus await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workflow traversal terminated abnormally: " + instanceId, e.getCause());
        }
    }

    /**
     * 종료 시 콜백을 받을 수 있는 future.
     *
     * @return 종료 상태 future
     */
    public CompletableFuture<WorkflowStatus> completion() {
        return completion;
    }

    @Override
    public String toString() {
        return "WorkflowHandle{instanceId=" + instanceId + ", alreadyRunning=" + alreadyRunning
            + ", done=" + completion.isDone() + "}";
    }
}
