package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.core.event.WorkflowEvent;
import com.ryuqq.sop.core.event.WorkflowEventHandler;
import com.ryuqq.sop.core.event.WorkflowEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Workflow 이벤트 핸들러 등록 및 전달.
 *
 * <p>핸들러는 이벤트를 발생시킨 스레드에서 등록 순서대로 호출됩니다.
 * 핸들러 예외는 ERROR 로그로 남기고 다음 핸들러로 진행하며, 순회에는 영향을 주지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkflowEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventDispatcher.class);

    private final Map<WorkflowEventType, List<WorkflowEventHandler>> handlers = new ConcurrentHashMap<>();

    public void register(WorkflowEventType type, WorkflowEventHandler handler) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void dispatch(WorkflowEvent event) {
        List<WorkflowEventHandler> registered = handlers.getOrDefault(event.type(), List.of());
        for (WorkflowEventHandler handler : registered) {
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                log.error("Event handler failed for {} on workflow {}", event.type(), event.instanceId(), e);
            }
        }
    }

    public int handlerCount(WorkflowEventType type) {
        return handlers.getOrDefault(type, List.of()).size();
    }
}
