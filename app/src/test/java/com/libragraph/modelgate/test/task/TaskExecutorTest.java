package com.libragraph.modelgate.test.task;

import com.libragraph.modelgate.core.provider.FailureCategory;
import com.libragraph.modelgate.core.task.ExecutionOutcome;
import com.libragraph.modelgate.core.task.TaskError;
import com.libragraph.modelgate.core.task.TaskExecutor;
import com.libragraph.modelgate.core.task.TaskRecord;
import com.libragraph.modelgate.core.task.TaskStatus;
import com.libragraph.modelgate.core.task.TaskStore;
import com.libragraph.modelgate.test.TaskAwaiter;
import com.libragraph.modelgate.test.VendorStubResource;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.libragraph.modelgate.test.VendorStubResource.vendorCallsContaining;
import static org.assertj.core.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(VendorStubResource.class)
class TaskExecutorTest {

    @Inject
    TaskExecutor executor;

    @Inject
    TaskStore store;

    @Inject
    TaskAwaiter tasks;

    // --- Successful execution ---

    @Test
    void completesAndStoresNormalizedResult() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", "hello " + nonce), "tester");

        ExecutionOutcome outcome = executor.execute(id);

        assertThat(outcome).isInstanceOf(ExecutionOutcome.Completed.class);
        TaskRecord record = tasks.get(id);
        assertThat(record.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(record.attempts()).isEqualTo(1);
        assertThat(record.error()).isNull();
        assertThat(record.startedAt()).isNotNull();
        assertThat(record.completedAt()).isNotNull();
        assertThat(store.result(record).firstMessage().content()).isEqualTo("echo: hello " + nonce);
        assertThat(store.result(record).model()).isEqualTo("qwen-turbo");
    }

    @Test
    void reasonerResultKeepsReasoningContent() {
        String id = tasks.insertPending("deepseek", "deepseek-reasoner",
                Map.of("messages", List.of(Map.of("role", "user", "content", "why " + nonce()))), "tester");

        executor.execute(id);

        TaskRecord record = tasks.get(id);
        assertThat(record.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(store.result(record).firstMessage().reasoningContent()).isEqualTo("thinking it through");
    }

    // --- At-most-once ---

    @Test
    void duplicateDeliveryIsSkipped() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", nonce), "tester");

        executor.execute(id);
        ExecutionOutcome second = executor.execute(id);

        assertThat(second).isEqualTo(new ExecutionOutcome.Skipped(TaskStatus.COMPLETED));
        assertThat(vendorCallsContaining(nonce)).isEqualTo(1);
    }

    @Test
    void concurrentDeliveriesInvokeProviderOnce() throws Exception {
        String nonce = nonce();
        String id = tasks.insertPending("deepseek", "deepseek-chat", Map.of("prompt", nonce), "tester");

        int deliveries = 4;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(deliveries);
        List<Future<ExecutionOutcome>> results = new ArrayList<>();
        try {
            for (int i = 0; i < deliveries; i++) {
                results.add(pool.submit(() -> {
                    go.await();
                    return executor.execute(id);
                }));
            }
            go.countDown();

            long executed = 0;
            for (Future<ExecutionOutcome> result : results) {
                if (!(result.get() instanceof ExecutionOutcome.Skipped)) {
                    executed++;
                }
            }
            assertThat(executed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(vendorCallsContaining(nonce)).isEqualTo(1);
        assertThat(tasks.get(id).status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void taskAlreadyProcessingElsewhereIsSkipped() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", nonce), "tester");
        assertThat(store.markProcessing(id)).isTrue();

        assertThat(executor.execute(id)).isEqualTo(new ExecutionOutcome.Skipped(TaskStatus.PROCESSING));
        assertThat(vendorCallsContaining(nonce)).isZero();
    }

    @Test
    void cancelledBeforeExecutionIsSkipped() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", nonce), "tester");
        assertThat(store.cancel(id)).isTrue();

        assertThat(executor.execute(id)).isEqualTo(new ExecutionOutcome.Skipped(TaskStatus.CANCELLED));
        assertThat(vendorCallsContaining(nonce)).isZero();
        assertThat(tasks.get(id).attempts()).isZero();
    }

    @Test
    void unknownTaskIsSkipped() {
        assertThat(executor.execute(UUID.randomUUID().toString())).isInstanceOf(ExecutionOutcome.Skipped.class);
    }

    // --- Failure classification and retry ---

    @Test
    void authenticationFailureIsNotRetried() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-turbo",
                Map.of("prompt", VendorStubResource.UNAUTHORIZED + nonce), "tester");

        ExecutionOutcome outcome = executor.execute(id);

        assertThat(outcome).isInstanceOf(ExecutionOutcome.Failed.class);
        TaskError error = ((ExecutionOutcome.Failed) outcome).error();
        assertThat(error.category()).isEqualTo(FailureCategory.AUTHENTICATION);
        assertThat(error.retryable()).isFalse();
        assertThat(vendorCallsContaining(nonce)).isEqualTo(1);

        TaskRecord record = tasks.get(id);
        assertThat(record.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(record.result()).isNull();
        assertThat(store.error(record)).isEqualTo(error);
    }

    @Test
    void transientFailureIsRetriedUpToLimit() {
        String nonce = nonce();
        String id = tasks.insertPending("deepseek", "deepseek-chat",
                Map.of("prompt", VendorStubResource.UNAVAILABLE + nonce), "tester");

        ExecutionOutcome outcome = executor.execute(id);

        assertThat(outcome).isInstanceOf(ExecutionOutcome.Failed.class);
        assertThat(((ExecutionOutcome.Failed) outcome).error().category())
                .isEqualTo(FailureCategory.UPSTREAM_UNAVAILABLE);
        int maxAttempts = executor.retryPolicy().maxAttempts();
        assertThat(vendorCallsContaining(nonce)).isEqualTo(maxAttempts);
        assertThat(tasks.get(id).attempts()).isEqualTo(maxAttempts);
    }

    @Test
    void unparseableVendorReplyFailsWithoutRetry() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-plus",
                Map.of("prompt", VendorStubResource.GARBAGE + nonce), "tester");

        ExecutionOutcome outcome = executor.execute(id);

        assertThat(((ExecutionOutcome.Failed) outcome).error().category())
                .isEqualTo(FailureCategory.MALFORMED_RESPONSE);
        assertThat(vendorCallsContaining(nonce)).isEqualTo(1);
    }

    @Test
    void slowVendorTimesOut() {
        String nonce = nonce();
        String id = tasks.insertPending("aliyun", "qwen-turbo",
                Map.of("prompt", VendorStubResource.SLOW + nonce), "tester");

        ExecutionOutcome outcome = executor.execute(id);

        assertThat(outcome).isInstanceOf(ExecutionOutcome.Failed.class);
        assertThat(((ExecutionOutcome.Failed) outcome).error().category()).isEqualTo(FailureCategory.TIMEOUT);
        TaskRecord record = tasks.get(id);
        assertThat(record.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(record.result()).isNull();
    }

    private static String nonce() {
        return "n-" + UUID.randomUUID();
    }
}
