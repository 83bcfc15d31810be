package com.ryuqq.sop.application.orchestrator;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import com.ryuqq.sop.core.statemachine.WorkflowStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowHandle / HumanTaskResponse 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class WorkflowHandleTest {

    @Test
    void started_핸들_완료_상태_대기() throws Exception {
        // given
        InstanceId id = InstanceId.of("inst-1");
        CompletableFuture<WorkflowStatus> completion = new CompletableFuture<>();
        WorkflowHandle handle = WorkflowHandle.started(id, completion);

        // when
        completion.complete(WorkflowStatus.COMPLETED);

        // then
        assertThat(handle.getInstanceId()).isEqualTo(id);
        assertThat(handle.isAlreadyRunning()).isFalse();
        assertThat(handle.isDone()).isTrue();
        assertThat(handle.await(Duration.ofSeconds(1))).isEqualTo(WorkflowStatus.COMPLETED);
    }

    @Test
    void alreadyRunning_핸들은_같은_future를_공유() {
        // given
        CompletableFuture<WorkflowStatus> completion = new CompletableFuture<>();

        // when
        WorkflowHandle first = WorkflowHandle.started(InstanceId.of("inst-1"), completion);
        WorkflowHandle repeat = WorkflowHandle.alreadyRunning(InstanceId.of("inst-1"), completion);

        // then
        assertThat(repeat.isAlreadyRunning()).isTrue();
        assertThat(repeat.completion()).isSameAs(first.completion());
    }

    @Test
    void await_시간_초과시_TimeoutException() {
        // given
        WorkflowHandle handle = WorkflowHandle.started(InstanceId.of("inst-1"), new CompletableFuture<>());

        // when & then
        assertThatThrownBy(() -> handle.await(Duration.ofMillis(20)))
            .isInstanceOf(TimeoutException.class);
    }

    @Test
    void instanceId_null이면_예외() {
        assertThatThrownBy(() -> WorkflowHandle.started(null, new CompletableFuture<>()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("instanceId cannot be null");
    }

    @Test
    void decided_응답은_decision_항목을_가짐() {
        // when
        HumanTaskResponse response = HumanTaskResponse.decided("approve", "kim");

        // then
        assertThat(response.completed()).isTrue();
        assertThat(((Value.MapValue) response.output()).get("decision"))
            .contains(Value.of("approve"));
        assertThat(response.respondedBy()).isEqualTo("kim");
    }
}
