package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.application.orchestrator.HumanTaskResponse;
import com.ryuqq.sop.application.orchestrator.WorkflowHandle;
import com.ryuqq.sop.application.orchestrator.WorkflowOrchestrator;
import com.ryuqq.sop.core.actor.ActorRegistry;
import com.ryuqq.sop.core.actor.RoleActor;
import com.ryuqq.sop.core.context.WorkflowContext;
import com.ryuqq.sop.core.event.WorkflowEvent;
import com.ryuqq.sop.core.event.WorkflowEventHandler;
import com.ryuqq.sop.core.event.WorkflowEventType;
import com.ryuqq.sop.core.graph.StepGraph;
import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.MessageId;
import com.ryuqq.sop.core.model.SopDefinition;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.record.WorkflowInstance;
import com.ryuqq.sop.core.spi.MessageBus;
import com.ryuqq.sop.core.spi.SopDefinitionSource;
import com.ryuqq.sop.core.spi.WorkflowStore;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link WorkflowOrchestrator} 구현체.
 *
 * <p>SOP 정의로부터 인스턴스를 생성하고, {@link StepExecutionEngine}에 순회를 위임하며,
 * 실행 중인 인스턴스의 컨텍스트와 완료 Future를 관리합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>인스턴스 생성 (PENDING 저장 + 컨텍스트 생성)</li>
 *   <li>시작: PENDING → IN_PROGRESS 저장 후 순회 제출, 중복 시작은 실행 중인 핸들 반환</li>
 *   <li>취소: CANCELLED 저장, 컨텍스트 취소 표시, Human Action 대기 중단</li>
 *   <li>Human Action 응답 전달</li>
 *   <li>Actor, 이벤트 핸들러 등록 및 메시지 전송 위임</li>
 * </ul>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>시작/취소/종료 전이는 인스턴스별 락으로 직렬화</li>
 *   <li>활성 인스턴스 테이블은 {@link ConcurrentHashMap}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowInstanceManager implements WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowInstanceManager.class);

    private final SopDefinitionSource definitions;
    private final ActorRegistry actors;
    private final MessageBus messageBus;
    private final ExecutionLedger ledger;
    private final HumanTaskCoordinator humanTasks = new HumanTaskCoordinator();
    private final WorkflowEventDispatcher events = new WorkflowEventDispatcher();
    private final StepExecutionEngine engine;

    private final ConcurrentHashMap<InstanceId, WorkflowContext> contexts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<InstanceId, CompletableFuture<WorkflowStatus>> traversals = new ConcurrentHashMap<>();

    /**
     * 생성자 (시스템 UTC Clock 사용).
     *
     * @param definitions SOP 정의 소스
     * @param store 레코드 저장소
     * @param actors Role Actor 레지스트리 (메시지 버스와 공유)
     * @param messageBus 메시지 버스
     * @param config 엔진 설정
     */
    public WorkflowInstanceManager(SopDefinitionSource definitions, WorkflowStore store, ActorRegistry actors,
                                   MessageBus messageBus, EngineConfig config) {
        this(definitions, store, actors, messageBus, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param definitions SOP 정의 소스
     * @param store 레코드 저장소
     * @param actors Role Actor 레지스트리 (메시지 버스와 공유)
     * @param messageBus 메시지 버스
     * @param config 엔진 설정
     * @param clock 시각 기준
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkflowInstanceManager(SopDefinitionSource definitions, WorkflowStore store, ActorRegistry actors,
                                   MessageBus messageBus, EngineConfig config, Clock clock) {
        if (definitions == null) {
            throw new IllegalArgumentException("definitions cannot be null");
        }
        if (actors == null) {
            throw new IllegalArgumentException("actors cannot be null");
        }
        if (messageBus == null) {
            throw new IllegalArgumentException("messageBus cannot be null");
        }
        this.definitions = definitions;
        this.actors = actors;
        this.messageBus = messageBus;
        this.ledger = new ExecutionLedger(store, clock);
        this.engine = new StepExecutionEngine(actors, messageBus, ledger, humanTasks, events, config);
    }

    @Override
    public InstanceId createInstance(String sopName, String triggerType, String triggerId, Value.MapValue initialData) {
        SopDefinition definition = definitions.load(sopName);
        Instant now = ledger.now();
        InstanceId instanceId = InstanceId.random();
        WorkflowInstance instance = WorkflowInstance.pending(instanceId, sopName, triggerType, triggerId,
            initialData, now, definition.dueAt(now).orElse(null));

        ledger.insertInstance(instance);
        contexts.put(instanceId, WorkflowContext.fromInstance(instance));
        log.info("Created workflow {} for SOP {} (trigger {}:{})", instanceId, sopName, triggerType, triggerId);
        return instanceId;
    }

    @Override
    public WorkflowHandle start(InstanceId instanceId) {
        if (instanceId == null) {
            throw new IllegalArgumentException("instanceId cannot be null");
        }
        ReentrantLock lock = ledger.lockFor(instanceId);
        lock.lock();
        try {
            WorkflowInstance instance = ledger.findInstance(instanceId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown workflow instance: " + instanceId));

            CompletableFuture<WorkflowStatus> running = traversals.get(instanceId);
            if (running != null && instance.status() == WorkflowStatus.IN_PROGRESS) {
                log.warn("Workflow {} is already running, ignoring repeated start", instanceId);
                return WorkflowHandle.alreadyRunning(instanceId, running);
            }
            if (instance.status() != WorkflowStatus.PENDING) {
                throw new IllegalStateException(
                    "Workflow " + instanceId + " cannot be started from status " + instance.status());
            }
            return launch(instance);
        } finally {
            releaseIfSettled(instanceId, lock);
            lock.unlock();
        }
    }

    private WorkflowHandle launch(WorkflowInstance instance) {
        InstanceId instanceId = instance.id();
        StepGraph graph;
        try {
            graph = StepGraph.of(definitions.load(instance.sopName()));
            ledger.saveInstance(instance.start(ledger.now()));
        } catch (RuntimeException e) {
            failBeforeTraversal(instanceId, e);
            throw e;
        }

        WorkflowContext context = contexts.computeIfAbsent(instanceId, id -> WorkflowContext.fromInstance(instance));
        CompletableFuture<WorkflowStatus> completion = new CompletableFuture<>();
        traversals.put(instanceId, completion);

        try {
            engine.submit(() -> traverse(context, graph))
                .whenComplete((status, error) -> finishTraversal(instanceId, completion, status, error));
        } catch (RuntimeException e) {
            traversals.remove(instanceId);
            contexts.remove(instanceId);
            failBeforeTraversal(instanceId, e);
            throw e;
        }
        log.info("Started workflow {} at step {}", instanceId, graph.entryStep().stepId());
        return WorkflowHandle.started(instanceId, completion);
    }

    private WorkflowStatus traverse(WorkflowContext context, StepGraph graph) {
        try {
            return engine.run(context, graph);
        } catch (RuntimeException e) {
            log.error("Traversal of workflow {} terminated abnormally", context.instanceId(), e);
            return engine.failInstance(context, "Workflow traversal aborted: " + e.getMessage(),
                context.currentStepId());
        }
    }

    private void finishTraversal(InstanceId instanceId, CompletableFuture<WorkflowStatus> completion,
                                 WorkflowStatus status, Throwable error) {
        ReentrantLock lock = ledger.lockFor(instanceId);
        lock.lock();
        try {
            traversals.remove(instanceId, completion);
            contexts.remove(instanceId);
            ledger.releaseLock(instanceId, lock);
        } finally {
            lock.unlock();
        }
        if (error != null) {
            completion.completeExceptionally(error);
        } else {
            completion.complete(status);
        }
    }

    private void failBeforeTraversal(InstanceId instanceId, RuntimeException cause) {
        String error = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        try {
            Instant now = ledger.now();
            ledger.finish(instanceId, instance -> instance.fail(error, now));
            log.error("Workflow {} failed to start: {}", instanceId, error);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public boolean cancel(InstanceId instanceId, String reason) {
        if (instanceId == null) {
            return false;
        }
        ReentrantLock lock = ledger.lockFor(instanceId);
        lock.lock();
        try {
            Optional<WorkflowInstance> found = ledger.findInstance(instanceId);
            if (found.isEmpty() || found.get().isTerminal()) {
                return false;
            }
            WorkflowInstance instance = found.get();
            Instant now = ledger.now();
            ledger.saveInstance(instance.cancel(reason, now));

            WorkflowContext context = contexts.get(instanceId);
            if (context != null) {
                context.markCancelled();
            }
            List<String> aborted = humanTasks.abortAll(instanceId);
            if (instance.status() == WorkflowStatus.PENDING) {
                contexts.remove(instanceId);
            }

            log.info("Cancelled workflow {} ({}), aborted human steps {}", instanceId, reason, aborted);
            events.dispatch(new WorkflowEvent(WorkflowEventType.WORKFLOW_CANCELLED, instanceId,
                cancellationPayload(reason, aborted), now));
            return true;
        } finally {
            releaseIfSettled(instanceId, lock);
            lock.unlock();
        }
    }

    /**
     * 미등록이거나 종료되었고 순회 중이 아닌 인스턴스의 락 해제.
     */
    private void releaseIfSettled(InstanceId instanceId, ReentrantLock lock) {
        if (traversals.containsKey(instanceId)) {
            return;
        }
        boolean settled = ledger.findInstance(instanceId)
            .map(WorkflowInstance::isTerminal)
            .orElse(true);
        if (settled) {
            ledger.releaseLock(instanceId, lock);
        }
    }

    private static Value.MapValue cancellationPayload(String reason, List<String> aborted) {
        List<Value> steps = new ArrayList<>(aborted.size());
        for (String stepId : aborted) {
            steps.add(Value.of(stepId));
        }
        Map<String, Value> payload = new LinkedHashMap<>();
        payload.put("reason", reason == null ? Value.nullValue() : Value.of(reason));
        payload.put("aborted_steps", Value.list(steps));
        return Value.map(payload);
    }

    @Override
    public boolean completeHumanStep(InstanceId instanceId, String stepId, HumanTaskResponse response) {
        if (instanceId == null || stepId == null) {
            throw new IllegalArgumentException("instanceId and stepId cannot be null");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        boolean resumed = humanTasks.complete(instanceId, stepId, response);
        if (!resumed) {
            log.warn("No pending human step {} for workflow {}", stepId, instanceId);
        }
        return resumed;
    }

    @Override
    public Optional<WorkflowInstance> getInstance(InstanceId instanceId) {
        if (instanceId == null) {
            return Optional.empty();
        }
        return ledger.findInstance(instanceId);
    }

    @Override
    public void registerActor(String role, RoleActor actor) {
        Optional<RoleActor> previous = actors.register(role, actor);
        if (previous.isPresent()) {
            log.info("Replaced actor for role {}", role);
        } else {
            log.info("Registered actor for role {}", role);
        }
    }

    @Override
    public void registerEventHandler(WorkflowEventType type, WorkflowEventHandler handler) {
        events.register(type, handler);
    }

    @Override
    public MessageId sendMessage(MessageDraft draft) {
        return messageBus.send(draft);
    }

    /**
     * 실행 중인 인스턴스 수.
     *
     * @return 순회 중인 인스턴스 수
     */
    public int activeCount() {
        return traversals.size();
    }

    int lockCount() {
        return ledger.lockCount();
    }

    @Override
    public void shutdown() {
        log.info("Shutting down workflow manager ({} active workflows)", traversals.size());
        engine.shutdown();
    }
}
