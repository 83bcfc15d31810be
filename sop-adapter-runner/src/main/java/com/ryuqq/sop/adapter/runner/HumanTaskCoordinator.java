package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.application.orchestrator.HumanTaskResponse;
import com.ryuqq.sop.core.model.InstanceId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 대기 중인 Human Action Step 관리.
 *
 * <p>(인스턴스 ID, Step ID) 쌍마다 하나의 {@link CompletableFuture}를 보관하며,
 * 순회 스레드는 이 Future에서 응답 또는 기한 만료를 기다립니다.</p>
 *
 * <p><strong>종료 경로:</strong></p>
 * <ul>
 *   <li>{@link #complete}: 외부 응답으로 Future 완료</li>
 *   <li>{@link #abortAll}: 취소로 Future cancel, 대기 측은 CancellationException 수신</li>
 *   <li>{@link #close}: 대기 측이 기한 만료 후 정리</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HumanTaskCoordinator {

    private final Map<WaitKey, CompletableFuture<HumanTaskResponse>> waits = new ConcurrentHashMap<>();

    /**
     * 응답 대기 등록.
     *
     * @param instanceId 인스턴스 ID
     * @param stepId Step ID
     * @return 응답 Future
     * @throws IllegalStateException 같은 Step에 대한 대기가 이미 있는 경우
     */
    public CompletableFuture<HumanTaskResponse> open(InstanceId instanceId, String stepId) {
        CompletableFuture<HumanTaskResponse> wait = new CompletableFuture<>();
        if (waits.putIfAbsent(new WaitKey(instanceId, stepId), wait) != null) {
            throw new IllegalStateException("Step " + stepId + " of workflow " + instanceId + " is already awaiting a response");
        }
        return wait;
    }

    /**
     * 대기 중인 Step에 응답 전달.
     *
     * @return 대기가 있어 완료된 경우 true
     */
    public boolean complete(InstanceId instanceId, String stepId, HumanTaskResponse response) {
        CompletableFuture<HumanTaskResponse> wait = waits.remove(new WaitKey(instanceId, stepId));
        return wait != null && wait.complete(response);
    }

    public boolean isWaiting(InstanceId instanceId, String stepId) {
        return waits.containsKey(new WaitKey(instanceId, stepId));
    }

    /**
     * 인스턴스의 모든 대기 취소.
     *
     * @param instanceId 인스턴스 ID
     * @return 취소된 Step ID 목록
     */
    public List<String> abortAll(InstanceId instanceId) {
        List<String> aborted = new ArrayList<>();
        for (Map.Entry<WaitKey, CompletableFuture<HumanTaskResponse>> entry : waits.entrySet()) {
            WaitKey key = entry.getKey();
            if (key.instanceId().equals(instanceId) && waits.remove(key, entry.getValue())) {
                entry.getValue().cancel(false);
                aborted.add(key.stepId());
            }
        }
        return aborted;
    }

    /**
     * 대기 정리 (이미 완료/취소된 경우 무시).
     */
    public void close(InstanceId instanceId, String stepId, CompletableFuture<HumanTaskResponse> wait) {
        waits.remove(new WaitKey(instanceId, stepId), wait);
    }

    private record WaitKey(InstanceId instanceId, String stepId) {
    }
}
