package com.libragraph.modelgate.test.task;

import com.libragraph.modelgate.core.auth.Caller;
import com.libragraph.modelgate.core.auth.CallerScope;
import com.libragraph.modelgate.core.queue.QueueEntry;
import com.libragraph.modelgate.core.queue.TaskQueue;
import com.libragraph.modelgate.core.task.CreateTaskCommand;
import com.libragraph.modelgate.core.task.TaskOrchestrator;
import com.libragraph.modelgate.core.task.TaskStatus;
import com.libragraph.modelgate.core.task.TaskView;
import com.libragraph.modelgate.core.task.TaskWorkerPool;
import com.libragraph.modelgate.test.TaskAwaiter;
import com.libragraph.modelgate.test.VendorStubResource;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs with the worker pool stopped so the test owns every claim.
 */
@QuarkusTest
@QuarkusTestResource(VendorStubResource.class)
class TaskQueueTest {

    private static final Caller USER = new Caller("queue-user", CallerScope.USER);

    @Inject
    TaskQueue queue;

    @Inject
    TaskWorkerPool workerPool;

    @Inject
    TaskOrchestrator orchestrator;

    @Inject
    TaskAwaiter tasks;

    @Inject
    Jdbi jdbi;

    @BeforeEach
    void stopWorkers() throws Exception {
        workerPool.stop();
        jdbi.useHandle(h -> h.execute("DELETE FROM task_queue"));
    }

    @AfterEach
    void restartWorkers() throws Exception {
        workerPool.start();
    }

    // --- Claiming ---

    @Test
    void claimIsExclusive() {
        String id = enqueuePending();

        Optional<QueueEntry> first = queue.claimNext("worker-a");
        Optional<QueueEntry> second = queue.claimNext("worker-b");

        assertThat(first).isPresent();
        assertThat(first.get().taskId()).isEqualTo(id);
        assertThat(first.get().claimedBy()).isEqualTo("worker-a");
        assertThat(first.get().deliveries()).isEqualTo(1);
        assertThat(second).isEmpty();
    }

    @Test
    void concurrentClaimsHaveOneWinner() throws Exception {
        enqueuePending();

        int contenders = 6;
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        List<Future<Optional<QueueEntry>>> claims = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String worker = "contender-" + i;
                claims.add(pool.submit(() -> {
                    go.await();
                    return queue.claimNext(worker);
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Optional<QueueEntry>> claim : claims) {
                if (claim.get().isPresent()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void claimsOldestFirst() {
        String older = enqueuePending();
        String newer = enqueuePending();

        assertThat(queue.claimNext("w").map(QueueEntry::taskId)).contains(older);
        assertThat(queue.claimNext("w").map(QueueEntry::taskId)).contains(newer);
    }

    @Test
    void acknowledgedEntryIsRemoved() {
        String id = enqueuePending();
        QueueEntry entry = queue.claimNext("w").orElseThrow();

        queue.acknowledge(entry);

        assertThat(queue.entriesFor(id)).isEmpty();
        assertThat(queue.size()).isZero();
    }

    // --- Withdrawal ---

    @Test
    void withdrawSkipsClaimedEntries() {
        String claimed = enqueuePending();
        queue.claimNext("w").orElseThrow();
        String waiting = enqueuePending();

        assertThat(queue.withdraw(claimed)).isZero();
        assertThat(queue.withdraw(waiting)).isEqualTo(1);
        assertThat(queue.entriesFor(claimed)).hasSize(1);
        assertThat(queue.entriesFor(waiting)).isEmpty();
    }

    @Test
    void cancellingQueuedTaskWithdrawsIt() {
        TaskView view = orchestrator.create(asyncCommand("cancel me"), USER);
        assertThat(queue.entriesFor(view.taskId())).hasSize(1);

        orchestrator.cancel(view.taskId(), USER);

        assertThat(queue.entriesFor(view.taskId())).isEmpty();
        assertThat(tasks.get(view.taskId()).status()).isEqualTo(TaskStatus.CANCELLED);
    }

    // --- Durability ---

    @Test
    void queuedTaskSurvivesWorkerRestart() throws Exception {
        TaskView view = orchestrator.create(asyncCommand("survive"), USER);
        assertThat(view.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(tasks.get(view.taskId()).status()).isEqualTo(TaskStatus.PENDING);

        workerPool.start();

        assertThat(tasks.awaitTerminal(view.taskId(), Duration.ofSeconds(10)).status())
                .isEqualTo(TaskStatus.COMPLETED);
        assertThat(queue.entriesFor(view.taskId())).isEmpty();
    }

    private String enqueuePending() {
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", "queued"), USER.principal());
        jdbi.useTransaction(h -> queue.enqueue(h, id));
        return id;
    }

    private static CreateTaskCommand asyncCommand(String prompt) {
        return new CreateTaskCommand("qwen-turbo", "aliyun", Map.of("prompt", prompt), true);
    }
}
