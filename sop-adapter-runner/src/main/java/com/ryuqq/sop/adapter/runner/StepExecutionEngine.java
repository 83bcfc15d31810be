package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.application.orchestrator.HumanTaskResponse;
import com.ryuqq.sop.core.actor.ActionResult;
import com.ryuqq.sop.core.actor.ActorInput;
import com.ryuqq.sop.core.actor.ActorRegistry;
import com.ryuqq.sop.core.actor.Decision;
import com.ryuqq.sop.core.actor.RoleActor;
import com.ryuqq.sop.core.context.WorkflowContext;
import com.ryuqq.sop.core.evaluation.CompletionCriteriaChecker;
import com.ryuqq.sop.core.evaluation.ConditionEvaluator;
import com.ryuqq.sop.core.event.WorkflowEvent;
import com.ryuqq.sop.core.event.WorkflowEventType;
import com.ryuqq.sop.core.exception.NoActorException;
import com.ryuqq.sop.core.exception.StepExecutionException;
import com.ryuqq.sop.core.exception.StepTimeoutException;
import com.ryuqq.sop.core.graph.StepGraph;
import com.ryuqq.sop.core.message.MessageDraft;
import com.ryuqq.sop.core.message.MessageType;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.model.WorkflowStep;
import com.ryuqq.sop.core.outcome.Completed;
import com.ryuqq.sop.core.outcome.Failed;
import com.ryuqq.sop.core.outcome.StepResult;
import com.ryuqq.sop.core.outcome.TimedOut;
import com.ryuqq.sop.core.record.StepRecord;
import com.ryuqq.sop.core.record.WorkflowInstance;
import com.ryuqq.sop.core.spi.MessageBus;
import com.ryuqq.sop.core.statemachine.StepStatus;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * SOP Step 그래프 순회 엔진.
 *
 * <p>명시적 작업 스택으로 Step 그래프를 깊이 우선 순회하며, Step 유형별로 실행을 분기합니다.</p>
 *
 * <p><strong>Step 처리 흐름:</strong></p>
 * <pre>
 * pop(stepId)
 *   ↓
 * 1. StepRecord IN_PROGRESS 저장, 인스턴스 current step 갱신
 * 2. 유형별 실행:
 *    - AUTOMATED    → Actor.executeAction (action마다, Step 타임아웃 내)
 *    - HUMAN_ACTION → 알림 메시지 + HUMAN_ACTION_REQUIRED 이벤트 → 응답 또는 기한 만료 대기
 *    - DECISION     → Actor.makeDecision (Actor 미등록 시 HUMAN_ACTION과 동일)
 *    - PARALLEL     → next_steps를 분기로 동시 실행, 전부 성공해야 완료
 * 3. StepRecord COMPLETED / TIMED_OUT 저장, 컨텍스트에 결과 기록
 * 4. ConditionEvaluator로 다음 Step 결정 → push
 *   ↓
 * 스택이 비면 인스턴스 COMPLETED
 * </pre>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>Step 실행 중 예외: StepRecord FAILED, 인스턴스 FAILED ("Step &lt;id&gt; failed: &lt;message&gt;")</li>
 *   <li>TIMED_OUT: failure 조건이 있으면 해당 분기, 없으면 인스턴스 FAILED ("Step &lt;id&gt; timed out")</li>
 *   <li>취소: 진행 중 Step은 SKIPPED, 다음 Step 진입 전 순회 중단</li>
 * </ul>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>순회 스레드 풀: 인스턴스당 하나의 순회, 병렬 분기당 하나의 작업</li>
 *   <li>Action 스레드 풀: Actor 호출 전용, {@code Future.get(timeout)}으로 타임아웃 적용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StepExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(StepExecutionEngine.class);

    static final String SYSTEM_ROLE = "system";

    private final ActorRegistry actors;
    private final MessageBus messageBus;
    private final ExecutionLedger ledger;
    private final HumanTaskCoordinator humanTasks;
    private final WorkflowEventDispatcher events;
    private final EngineConfig config;
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
    private final CompletionCriteriaChecker criteriaChecker = new CompletionCriteriaChecker();
    private final ExecutorService traversalExecutor;
    private final ExecutorService actionExecutor;

    /**
     * 생성자.
     *
     * @param actors Role Actor 레지스트리
     * @param messageBus 메시지 버스 (Human Action 알림)
     * @param ledger 레코드 기록
     * @param humanTasks Human Action 대기 관리
     * @param events 이벤트 전달
     * @param config 엔진 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StepExecutionEngine(ActorRegistry actors, MessageBus messageBus, ExecutionLedger ledger,
                               HumanTaskCoordinator humanTasks, WorkflowEventDispatcher events,
                               EngineConfig config) {
        if (actors == null) {
            throw new IllegalArgumentException("actors cannot be null");
        }
        if (messageBus == null) {
            throw new IllegalArgumentException("messageBus cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (humanTasks == null) {
            throw new IllegalArgumentException("humanTasks cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.actors = actors;
        this.messageBus = messageBus;
        this.ledger = ledger;
        this.humanTasks = humanTasks;
        this.events = events;
        this.config = config;
        this.traversalExecutor = Executors.newCachedThreadPool();
        this.actionExecutor = Executors.newFixedThreadPool(config.actionThreads());
    }

    /**
     * 순회 작업을 순회 스레드 풀에서 비동기 실행.
     *
     * @param traversal 순회 작업
     * @return 순회 결과 Future
     */
    public CompletableFuture<WorkflowStatus> submit(Supplier<WorkflowStatus> traversal) {
        return CompletableFuture.supplyAsync(traversal, traversalExecutor);
    }

    /**
     * 진입 Step부터 그래프 순회.
     *
     * <p>호출 스레드에서 순회를 끝까지 실행하고, 인스턴스의 최종 상태를 반환합니다.
     * 인스턴스 종료 전이(COMPLETED/FAILED)와 종료 이벤트 발생까지 수행합니다.</p>
     *
     * @param context 실행 컨텍스트
     * @param graph Step 그래프
     * @return 최종 상태 (COMPLETED, FAILED, CANCELLED)
     * @throws com.ryuqq.sop.core.exception.PersistenceException 종료 전이 저장 실패 시
     */
    public WorkflowStatus run(WorkflowContext context, StepGraph graph) {
        InstanceId instanceId = context.instanceId();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(graph.entryStep().stepId());

        try {
            while (!pending.isEmpty()) {
                if (context.isCancelled()) {
                    log.info("Workflow {} cancelled, stopping before step {}", instanceId, pending.peek());
                    return WorkflowStatus.CANCELLED;
                }
                WorkflowStep step = graph.require(pending.pop());
                List<String> next = executeStep(context, graph, step);
                for (int i = next.size() - 1; i >= 0; i--) {
                    pending.push(next.get(i));
                }
            }
        } catch (CancellationException e) {
            log.info("Workflow {} cancelled while step {} was in progress", instanceId, context.currentStepId());
            return WorkflowStatus.CANCELLED;
        } catch (StepTimeoutException e) {
            return failInstance(context, "Step " + e.getStepId() + " timed out", e.getStepId());
        } catch (StepExecutionException e) {
            return failInstance(context, "Step " + e.getStepId() + " failed: " + e.getMessage(), e.getStepId());
        }
        return completeInstance(context);
    }

    /**
     * Step 하나를 실행하고 다음 Step ID 목록을 반환.
     *
     * @throws StepExecutionException Step 실행 실패 시
     * @throws StepTimeoutException 타임아웃을 처리할 failure 조건이 없는 경우
     * @throws CancellationException 대기 중 인스턴스가 취소된 경우
     */
    private List<String> executeStep(WorkflowContext context, StepGraph graph, WorkflowStep step) {
        InstanceId instanceId = context.instanceId();
        int executions = context.incrementStepExecutions();
        Duration timeout = timeoutOf(step);
        Instant startedAt = ledger.now();
        Instant deadline = startedAt.plus(timeout);

        StepRecord record = ledger.beginStep(instanceId, step, startedAt, deadline);
        ledger.moveTo(instanceId, step);
        context.setCurrentStepId(step.stepId());
        log.debug("Workflow {} entering {} step {} (role {})", instanceId, step.type(), step.stepId(), step.assignedRole());

        StepOutcome outcome;
        try {
            if (executions > config.maxStepExecutions()) {
                throw new StepExecutionException(step.stepId(),
                    "step execution budget of " + config.maxStepExecutions() + " exceeded");
            }
            outcome = dispatch(context, graph, step, timeout, deadline);
        } catch (CancellationException e) {
            ledger.finishStep(record, StepStatus.SKIPPED, Value.nullValue());
            throw e;
        } catch (RuntimeException e) {
            String message = describe(e);
            Failed failed = Failed.of(message);
            ledger.finishStep(record, StepStatus.FAILED, failed.toValue());
            context.recordResult(step.stepId(), failed);
            throw new StepExecutionException(step.stepId(), message, e);
        }

        StepResult result = outcome.result();
        ledger.finishStep(record, result.isTimedOut() ? StepStatus.TIMED_OUT : StepStatus.COMPLETED, result.toValue());
        context.recordResult(step.stepId(), result);

        if (result.isTimedOut()) {
            if (conditionEvaluator.firstMatch(step, result).isEmpty()) {
                log.warn("Step {} of workflow {} timed out after {}ms with no failure route",
                    step.stepId(), instanceId, timeout.toMillis());
                throw new StepTimeoutException(step.stepId(), timeout);
            }
            log.info("Step {} of workflow {} timed out, following failure route", step.stepId(), instanceId);
        }

        if (outcome.continuation() != null && conditionEvaluator.firstMatch(step, result).isEmpty()) {
            return outcome.continuation();
        }
        return conditionEvaluator.nextSteps(step, result);
    }

    private StepOutcome dispatch(WorkflowContext context, StepGraph graph, WorkflowStep step,
                                 Duration timeout, Instant deadline) {
        return switch (step.type()) {
            case AUTOMATED -> StepOutcome.of(executeAutomated(context, step, timeout));
            case HUMAN_ACTION -> StepOutcome.of(awaitHuman(context, step, timeout, deadline));
            case DECISION -> StepOutcome.of(executeDecision(context, step, timeout, deadline));
            case PARALLEL -> executeParallel(context, graph, step);
        };
    }

    private StepResult executeAutomated(WorkflowContext context, WorkflowStep step, Duration timeout) {
        RoleActor actor = actors.find(step.assignedRole())
            .orElseThrow(() -> new NoActorException(step.assignedRole()));
        ActorInput input = inputFor(context, step);
        long deadlineNanos = System.nanoTime() + timeout.toNanos();

        Map<String, ActionResult> results = new LinkedHashMap<>();
        for (String action : step.actions()) {
            long remaining = deadlineNanos - System.nanoTime();
            ActionResult result;
            try {
                result = callActor(() -> actor.executeAction(action, input), remaining, step, "action '" + action + "'");
            } catch (TimeoutException e) {
                log.warn("Action {} of step {} timed out in workflow {}", action, step.stepId(), context.instanceId());
                return new TimedOut(timeout);
            }
            if (result == null) {
                throw new StepExecutionException(step.stepId(), "actor returned no result for action '" + action + "'");
            }
            results.put(action, result);
        }

        boolean satisfied = criteriaChecker.isComplete(step.completionCriteria(), step.actions(), results);
        Map<String, Value> output = new LinkedHashMap<>();
        for (Map.Entry<String, ActionResult> entry : results.entrySet()) {
            output.put(entry.getKey(), entry.getValue().toValue());
        }
        return new Completed(satisfied, Value.map(output), ledger.now());
    }

    private StepResult executeDecision(WorkflowContext context, WorkflowStep step, Duration timeout, Instant deadline) {
        Optional<RoleActor> actor = actors.find(step.assignedRole());
        if (actor.isEmpty()) {
            log.info("No actor for role {}, routing decision step {} to a human", step.assignedRole(), step.stepId());
            return awaitHuman(context, step, timeout, deadline);
        }
        ActorInput input = inputFor(context, step);
        Decision decision;
        try {
            decision = callActor(() -> actor.get().makeDecision(input), timeout.toNanos(), step, "decision");
        } catch (TimeoutException e) {
            log.warn("Decision step {} timed out in workflow {}", step.stepId(), context.instanceId());
            return new TimedOut(timeout);
        }
        if (decision == null) {
            throw new StepExecutionException(step.stepId(), "actor returned no decision");
        }
        return Completed.satisfied(decision.toValue(), ledger.now());
    }

    private StepResult awaitHuman(WorkflowContext context, WorkflowStep step, Duration timeout, Instant deadline) {
        InstanceId instanceId = context.instanceId();
        CompletableFuture<HumanTaskResponse> wait = humanTasks.open(instanceId, step.stepId());
        try {
            if (context.isCancelled()) {
                throw new CancellationException("Workflow " + instanceId + " was cancelled");
            }
            notifyAssignee(instanceId, step, deadline);

            HumanTaskResponse response = wait.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Human step {} of workflow {} answered (completed={})", step.stepId(), instanceId, response.completed());
            return new Completed(response.completed(), response.output(), ledger.now());
        } catch (TimeoutException e) {
            log.warn("Human step {} of workflow {} expired at {}", step.stepId(), instanceId, deadline);
            return new TimedOut(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.stepId(), "interrupted while awaiting human response", e);
        } catch (ExecutionException e) {
            throw new StepExecutionException(step.stepId(), describe(e.getCause()), e.getCause());
        } finally {
            humanTasks.close(instanceId, step.stepId(), wait);
        }
    }

    private void notifyAssignee(InstanceId instanceId, WorkflowStep step, Instant deadline) {
        List<Value> actions = new ArrayList<>();
        for (String action : step.actions()) {
            actions.add(Value.of(action));
        }
        Map<String, Value> data = new LinkedHashMap<>();
        data.put("step_id", Value.of(step.stepId()));
        data.put("actions", Value.list(actions));
        data.put("deadline", Value.of(deadline.toString()));

        messageBus.send(MessageDraft.of(SYSTEM_ROLE, step.assignedRole(), MessageType.NOTIFICATION,
                "Action required: " + step.name(),
                "Please complete the following task: " + step.description())
            .withData(Value.map(data))
            .withInstanceId(instanceId));

        Map<String, Value> payload = new LinkedHashMap<>(data);
        payload.put("step_name", Value.of(step.name()));
        payload.put("assigned_role", Value.of(step.assignedRole()));
        events.dispatch(new WorkflowEvent(WorkflowEventType.HUMAN_ACTION_REQUIRED, instanceId,
            Value.map(payload), ledger.now()));
    }

    private StepOutcome executeParallel(WorkflowContext context, StepGraph graph, WorkflowStep step) {
        List<String> branchIds = step.nextSteps();
        List<Future<List<String>>> branches = new ArrayList<>(branchIds.size());
        for (String branchId : branchIds) {
            WorkflowStep branch = graph.require(branchId);
            branches.add(traversalExecutor.submit(() -> executeStep(context, graph, branch)));
        }

        Set<String> continuation = new LinkedHashSet<>();
        RuntimeException firstFailure = null;
        String failedBranch = null;
        boolean cancelled = false;
        for (int i = 0; i < branches.size(); i++) {
            try {
                continuation.addAll(branches.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepExecutionException(step.stepId(), "interrupted while joining parallel branches", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof CancellationException) {
                    cancelled = true;
                } else if (firstFailure == null) {
                    firstFailure = cause instanceof RuntimeException runtime
                        ? runtime
                        : new StepExecutionException(branchIds.get(i), describe(cause), cause);
                    failedBranch = branchIds.get(i);
                }
            }
        }

        if (firstFailure != null) {
            throw new StepExecutionException(step.stepId(),
                "parallel branch " + failedBranch + " failed: " + branchFailureMessage(firstFailure), firstFailure);
        }
        if (cancelled) {
            throw new CancellationException("Workflow " + context.instanceId() + " was cancelled");
        }

        Map<String, StepResult> results = context.stepResults();
        List<Value> output = new ArrayList<>(branchIds.size());
        for (String branchId : branchIds) {
            Map<String, Value> entry = new LinkedHashMap<>();
            entry.put("step_id", Value.of(branchId));
            StepResult branchResult = results.get(branchId);
            entry.put("result", branchResult == null ? Value.nullValue() : branchResult.toValue());
            output.add(Value.map(entry));
        }
        return new StepOutcome(Completed.satisfied(Value.list(output), ledger.now()), List.copyOf(continuation));
    }

    private <T> T callActor(Callable<T> call, long timeoutNanos, WorkflowStep step, String what) throws TimeoutException {
        if (timeoutNanos <= 0) {
            throw new TimeoutException();
        }
        Future<T> future = actionExecutor.submit(call);
        try {
            return future.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepExecutionException(step.stepId(), "interrupted while awaiting " + what, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new StepExecutionException(step.stepId(), describe(cause), cause);
        }
    }

    private WorkflowStatus completeInstance(WorkflowContext context) {
        Instant now = ledger.now();
        Optional<WorkflowInstance> completed = ledger.finish(context.instanceId(), instance -> instance.complete(now));
        if (completed.isEmpty()) {
            return currentStatus(context.instanceId());
        }
        List<Value> steps = new ArrayList<>();
        for (String stepId : context.completedSteps()) {
            steps.add(Value.of(stepId));
        }
        log.info("Workflow {} completed ({} steps)", context.instanceId(), steps.size());
        Map<String, Value> payload = new LinkedHashMap<>();
        payload.put("sop_name", Value.of(completed.get().sopName()));
        payload.put("completed_steps", Value.list(steps));
        events.dispatch(new WorkflowEvent(WorkflowEventType.WORKFLOW_COMPLETED, context.instanceId(),
            Value.map(payload), now));
        return WorkflowStatus.COMPLETED;
    }

    /**
     * 인스턴스를 FAILED로 전이하고 WORKFLOW_FAILED 이벤트 발생.
     *
     * @param context 실행 컨텍스트
     * @param error 인스턴스에 기록할 오류
     * @param failedStepId 실패한 Step ID (특정할 수 없으면 null)
     * @return 최종 상태 (이미 종료된 경우 해당 상태)
     */
    WorkflowStatus failInstance(WorkflowContext context, String error, String failedStepId) {
        Instant now = ledger.now();
        Optional<WorkflowInstance> failed = ledger.finish(context.instanceId(), instance -> instance.fail(error, now));
        if (failed.isEmpty()) {
            return currentStatus(context.instanceId());
        }
        log.error("Workflow {} failed: {}", context.instanceId(), error);
        Map<String, Value> payload = new LinkedHashMap<>();
        payload.put("error", Value.of(error));
        if (failedStepId != null) {
            payload.put("step_id", Value.of(failedStepId));
        }
        events.dispatch(new WorkflowEvent(WorkflowEventType.WORKFLOW_FAILED, context.instanceId(),
            Value.map(payload), now));
        return WorkflowStatus.FAILED;
    }

    private WorkflowStatus currentStatus(InstanceId instanceId) {
        return ledger.findInstance(instanceId)
            .map(WorkflowInstance::status)
            .orElseThrow(() -> new IllegalStateException("Workflow instance disappeared: " + instanceId));
    }

    private ActorInput inputFor(WorkflowContext context, WorkflowStep step) {
        return new ActorInput(context.instanceId(), context.data(), context.stepResults(), step);
    }

    private Duration timeoutOf(WorkflowStep step) {
        return step.timeout().isZero() ? config.defaultStepTimeout() : step.timeout();
    }

    private static String branchFailureMessage(RuntimeException failure) {
        if (failure instanceof StepTimeoutException timeout) {
            return "step " + timeout.getStepId() + " timed out";
        }
        return describe(failure);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    /**
     * 순회 및 Actor 스레드 풀 종료.
     *
     * <p>shutdownTimeoutMs 동안 진행 중인 작업을 기다린 뒤 남은 작업을 인터럽트합니다.</p>
     */
    public void shutdown() {
        traversalExecutor.shutdown();
        actionExecutor.shutdown();
        try {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.shutdownTimeoutMs());
            if (!traversalExecutor.awaitTermination(deadline - System.nanoTime(), TimeUnit.NANOSECONDS)) {
                log.warn("Traversals still running after {}ms, interrupting", config.shutdownTimeoutMs());
                traversalExecutor.shutdownNow();
            }
            if (!actionExecutor.awaitTermination(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS)) {
                actionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            traversalExecutor.shutdownNow();
            actionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Step 실행 결과와, 조건 분기가 없을 때 사용할 후속 Step 목록 (null이면 정적 next_steps).
     */
    private record StepOutcome(StepResult result, List<String> continuation) {

        static StepOutcome of(StepResult result) {
            return new StepOutcome(result, null);
        }
    }
}
