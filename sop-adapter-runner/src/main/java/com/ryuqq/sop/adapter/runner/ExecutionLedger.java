package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.core.exception.PersistenceException;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.record.StepRecord;
import com.ryuqq.sop.core.record.WorkflowInstance;
import com.ryuqq.sop.core.spi.WorkflowStore;
import com.ryuqq.sop.core.statemachine.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * 인스턴스 레코드와 Step 레코드의 단일 기록 창구.
 *
 * <p><strong>쓰기 규칙:</strong></p>
 * <ul>
 *   <li>인스턴스 상태 전이: 영속화 실패 시 {@link PersistenceException}을 그대로 전파</li>
 *   <li>Step 레코드, 현재 Step 갱신: 실패 시 WARN 로그 후 순회 계속</li>
 *   <li>동일 인스턴스에 대한 레코드 갱신은 인스턴스별 락으로 직렬화 (병렬 분기 대응)</li>
 * </ul>
 *
 * <p>삽입에 실패한 Step 레코드는 종료 시점에 다시 삽입을 시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionLedger {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

    private final WorkflowStore store;
    private final Clock clock;
    private final ConcurrentHashMap<InstanceId, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> unpersistedSteps = ConcurrentHashMap.newKeySet();

    public ExecutionLedger(WorkflowStore store, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * 인스턴스별 락.
     *
     * @param instanceId 인스턴스 ID
     * @return 재진입 가능한 락
     */
    public ReentrantLock lockFor(InstanceId instanceId) {
        return locks.computeIfAbsent(instanceId, id -> new ReentrantLock());
    }

    /**
     * 더 이상 전이가 없는 인스턴스의 락 해제 (락을 보유한 상태에서 호출).
     *
     * <p>종료 상태는 단조적이므로 이후 새로 생성된 락과 경합해도 레코드가 바뀌지 않습니다.</p>
     *
     * @param instanceId 인스턴스 ID
     * @param lock {@link #lockFor}로 얻은 락
     */
    public void releaseLock(InstanceId instanceId, ReentrantLock lock) {
        locks.remove(instanceId, lock);
    }

    int lockCount() {
        return locks.size();
    }

    public void insertInstance(WorkflowInstance instance) {
        store.insertInstance(instance);
    }

    public Optional<WorkflowInstance> findInstance(InstanceId instanceId) {
        return store.findInstance(instanceId);
    }

    /**
     * 인스턴스 상태 전이 저장.
     *
     * @param instance 전이된 인스턴스
     * @throws PersistenceException 저장 실패 시
     */
    public void saveInstance(WorkflowInstance instance) {
        ReentrantLock lock = lockFor(instance.id());
        lock.lock();
        try {
            store.updateInstance(instance);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 아직 종료되지 않은 인스턴스를 종료 상태로 전이.
     *
     * <p>취소 등으로 이미 종료된 인스턴스는 변경하지 않습니다.</p>
     *
     * @param instanceId 인스턴스 ID
     * @param transition 종료 전이 함수
     * @return 전이된 인스턴스 (이미 종료되었거나 없으면 empty)
     * @throws PersistenceException 저장 실패 시
     */
    public Optional<WorkflowInstance> finish(InstanceId instanceId, UnaryOperator<WorkflowInstance> transition) {
        ReentrantLock lock = lockFor(instanceId);
        lock.lock();
        try {
            Optional<WorkflowInstance> current = store.findInstance(instanceId);
            if (current.isEmpty() || current.get().isTerminal()) {
                return Optional.empty();
            }
            WorkflowInstance next = transition.apply(current.get());
            store.updateInstance(next);
            return Optional.of(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 인스턴스의 현재 Step/Role 갱신.
     *
     * @param instanceId 인스턴스 ID
     * @param step 진입한 Step
     */
    public void moveTo(InstanceId instanceId, WorkflowStep step) {
        ReentrantLock lock = lockFor(instanceId);
        lock.lock();
        try {
            Optional<WorkflowInstance> current = store.findInstance(instanceId);
            if (current.isPresent() && !current.get().isTerminal()) {
                store.updateInstance(current.get().atStep(step.stepId(), step.assignedRole()));
            }
        } catch (PersistenceException e) {
            log.warn("Failed to record current step {} for workflow {}: {}",
                step.stepId(), instanceId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * IN_PROGRESS Step 레코드 생성.
     *
     * @param instanceId 인스턴스 ID
     * @param step Step
     * @param startedAt 시작 시각
     * @param deadline 기한
     * @return 생성된 레코드 (저장 실패 시에도 반환)
     */
    public StepRecord beginStep(InstanceId instanceId, WorkflowStep step, Instant startedAt, Instant deadline) {
        StepRecord record = StepRecord.started(instanceId, step, startedAt, deadline);
        try {
            store.insertStep(record);
        } catch (PersistenceException e) {
            unpersistedSteps.add(record.recordId());
            log.warn("Failed to persist step record {} of workflow {}: {}",
                step.stepId(), instanceId, e.getMessage());
        }
        return record;
    }

    /**
     * Step 레코드 종료.
     *
     * @param record IN_PROGRESS 레코드
     * @param status 종료 상태
     * @param result 결과
     * @return 종료된 레코드
     */
    public StepRecord finishStep(StepRecord record, StepStatus status, Value result) {
        StepRecord finished = record.finish(status, result, clock.instant());
        try {
            if (unpersistedSteps.remove(record.recordId())) {
                store.insertStep(finished);
            } else {
                store.updateStep(finished);
            }
        } catch (PersistenceException e) {
            log.warn("Failed to persist {} result of step {} in workflow {}: {}",
                status, record.stepId(), record.instanceId(), e.getMessage());
        }
        return finished;
    }
}
