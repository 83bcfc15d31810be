package com.ryuqq.sop.adapter.runner;

import com.ryuqq.sop.application.orchestrator.HumanTaskResponse;
import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.model.Value;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HumanTaskCoordinatorTest {

    private final HumanTaskCoordinator coordinator = new HumanTaskCoordinator();
    private final InstanceId instanceId = InstanceId.of("wf-1");

    @Test
    void complete_대기_중이면_응답_전달() {
        // given
        CompletableFuture<HumanTaskResponse> wait = coordinator.open(instanceId, "approve");
        HumanTaskResponse response = HumanTaskResponse.completed(Value.of("signed"));

        // when
        boolean delivered = coordinator.complete(instanceId, "approve", response);

        // then
        assertThat(delivered).isTrue();
        assertThat(wait).isCompletedWithValue(response);
        assertThat(coordinator.isWaiting(instanceId, "approve")).isFalse();
    }

    @Test
    void complete_대기가_없으면_false() {
        assertThat(coordinator.complete(instanceId, "approve", HumanTaskResponse.completed(Value.emptyMap())))
            .isFalse();
    }

    @Test
    void open_같은_Step_중복_대기는_IllegalStateException() {
        // given
        coordinator.open(instanceId, "approve");

        // when & then
        assertThatThrownBy(() -> coordinator.open(instanceId, "approve"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("approve");
    }

    @Test
    void abortAll_해당_인스턴스의_대기만_취소() {
        // given
        CompletableFuture<HumanTaskResponse> first = coordinator.open(instanceId, "inspect");
        CompletableFuture<HumanTaskResponse> second = coordinator.open(instanceId, "photograph");
        InstanceId other = InstanceId.of("wf-2");
        CompletableFuture<HumanTaskResponse> unrelated = coordinator.open(other, "inspect");

        // when
        assertThat(coordinator.abortAll(instanceId)).containsExactlyInAnyOrder("inspect", "photograph");

        // then
        assertThat(first).isCancelled();
        assertThat(second).isCancelled();
        assertThat(unrelated).isNotDone();
        assertThat(coordinator.isWaiting(other, "inspect")).isTrue();
    }

    @Test
    void close_다른_대기는_제거하지_않음() {
        // given
        CompletableFuture<HumanTaskResponse> stale = new CompletableFuture<>();
        coordinator.open(instanceId, "approve");

        // when
        coordinator.close(instanceId, "approve", stale);

        // then
        assertThat(coordinator.isWaiting(instanceId, "approve")).isTrue();
    }
}
