package com.ryuqq.sop.testkit.fixture;

import com.ryuqq.sop.core.actor.ActionResult;
import com.ryuqq.sop.core.actor.ActorInput;
import com.ryuqq.sop.core.actor.Decision;
import com.ryuqq.sop.core.actor.RoleActor;
import com.ryuqq.sop.core.message.Message;
import com.ryuqq.sop.core.model.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scripted {@link RoleActor} for engine tests.
 *
 * <p>Each action can be scripted to return a result, raise an exception or block
 * for a while before answering. Unscripted actions complete with their own name
 * as output. Every call is recorded so tests can assert on invocation order and count.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedRoleActor technician = ScriptedRoleActor.completingAll()
 *     .failOn("order_parts", new IllegalStateException("supplier down"))
 *     .delayOn("inspect", Duration.ofSeconds(2));
 * ScriptedRoleActor supervisor = ScriptedRoleActor.deciding("approve");
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedRoleActor implements RoleActor {

    private final Map<String, ActionResult> results = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final List<String> invocations = new CopyOnWriteArrayList<>();
    private final List<ActorInput> inputs = new CopyOnWriteArrayList<>();
    private final List<Message> receivedMessages = new CopyOnWriteArrayList<>();
    private volatile Decision decision;
    private volatile RuntimeException messageFailure;

    private ScriptedRoleActor() {
    }

    /**
     * Actor whose unscripted actions all complete.
     *
     * @return a new actor
     */
    public static ScriptedRoleActor completingAll() {
        return new ScriptedRoleActor();
    }

    /**
     * Actor that answers every decision with the given value.
     *
     * @param decisionValue the decision value
     * @return a new actor
     */
    public static ScriptedRoleActor deciding(String decisionValue) {
        ScriptedRoleActor actor = new ScriptedRoleActor();
        actor.decision = Decision.of(decisionValue, "scripted");
        return actor;
    }

    public ScriptedRoleActor onAction(String action, ActionResult result) {
        results.put(action, result);
        return this;
    }

    public ScriptedRoleActor incompleteOn(String action) {
        return onAction(action, ActionResult.incomplete(Value.of(action)));
    }

    public ScriptedRoleActor failOn(String action, RuntimeException failure) {
        failures.put(action, failure);
        return this;
    }

    public ScriptedRoleActor delayOn(String action, Duration delay) {
        delays.put(action, delay);
        return this;
    }

    public ScriptedRoleActor failOnMessage(RuntimeException failure) {
        this.messageFailure = failure;
        return this;
    }

    @Override
    public ActionResult executeAction(String action, ActorInput input) throws Exception {
        invocations.add(action);
        inputs.add(input);
        Duration delay = delays.get(action);
        if (delay != null) {
            Thread.sleep(delay.toMillis());
        }
        RuntimeException failure = failures.get(action);
        if (failure != null) {
            throw failure;
        }
        return results.getOrDefault(action, ActionResult.completed(Value.of(action)));
    }

    @Override
    public Decision makeDecision(ActorInput input) throws Exception {
        invocations.add("decide:" + input.step().stepId());
        inputs.add(input);
        Decision scripted = decision;
        if (scripted == null) {
            return RoleActor.super.makeDecision(input);
        }
        return scripted;
    }

    @Override
    public void receiveMessage(Message message) {
        receivedMessages.add(message);
        RuntimeException failure = messageFailure;
        if (failure != null) {
            throw failure;
        }
    }

    public List<String> invocations() {
        return List.copyOf(invocations);
    }

    public long invocationCount(String action) {
        return invocations.stream().filter(action::equals).count();
    }

    public List<ActorInput> inputs() {
        return List.copyOf(inputs);
    }

    public List<Message> receivedMessages() {
        return List.copyOf(receivedMessages);
    }
}
