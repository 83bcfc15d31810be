package com.ryuqq.sop.adapter.inmemory.store;

import com.ryuqq.sop.core.model.InstanceId;
import com.ryuqq.sop.core.spi.WorkflowStore;
import com.ryuqq.sop.testkit.contract.AbstractWorkflowStoreContractTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for InMemoryWorkflowStore adapter.
 *
 * <p>Inherits the persistence contract from {@link AbstractWorkflowStoreContractTest}
 * and adds in-memory specific checks (concurrent inserts, clear).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see AbstractWorkflowStoreContractTest
 */
class InMemoryWorkflowStoreContractTest extends AbstractWorkflowStoreContractTest {

    @Override
    protected WorkflowStore createStore() {
        return new InMemoryWorkflowStore();
    }

    @Test
    void insertStep_ConcurrentBranches_AllRecordsListed() throws Exception {
        // Given
        InstanceId instanceId = InstanceId.of("concurrent-1");
        int branches = 16;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<String> stepIds = new ArrayList<>();
        for (int i = 0; i < branches; i++) {
            stepIds.add("branch_" + i);
        }

        // When
        try {
            for (String stepId : stepIds) {
                executor.submit(() -> {
                    start.await();
                    store.insertStep(createTestStepRecord(instanceId, stepId));
                    return null;
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // Then
        assertEquals(branches, store.findStepsByInstance(instanceId).size());
    }

    @Test
    void clear_RemovesEverything() {
        // Given
        InMemoryWorkflowStore inMemory = (InMemoryWorkflowStore) store;
        inMemory.insertInstance(createTestInstance("clear-1"));
        inMemory.insertMessage(createTestMessage());

        // When
        inMemory.clear();

        // Then
        assertTrue(inMemory.findInstance(InstanceId.of("clear-1")).isEmpty());
        assertTrue(inMemory.allMessages().isEmpty());
    }
}
