package com.libragraph.modelgate.test.task;

import com.libragraph.modelgate.core.provider.FailureCategory;
import com.libragraph.modelgate.core.queue.QueueEntry;
import com.libragraph.modelgate.core.queue.TaskQueue;
import com.libragraph.modelgate.core.task.TaskError;
import com.libragraph.modelgate.core.task.TaskReaper;
import com.libragraph.modelgate.core.task.TaskRecord;
import com.libragraph.modelgate.core.task.TaskStatus;
import com.libragraph.modelgate.core.task.TaskStore;
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
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
@QuarkusTestResource(VendorStubResource.class)
class TaskReaperTest {

    @Inject
    TaskReaper reaper;

    @Inject
    TaskQueue queue;

    @Inject
    TaskStore store;

    @Inject
    TaskWorkerPool workerPool;

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

    // --- Stale claims ---

    @Test
    void releasesClaimsPastTheLease() {
        String id = enqueuePending();
        QueueEntry claimed = queue.claimNext("vanished-worker").orElseThrow();
        jdbi.useHandle(h -> h.createUpdate("UPDATE task_queue SET claimed_at = :at WHERE id = :id")
                .bind("at", Instant.now().minus(Duration.ofHours(1)))
                .bind("id", claimed.id())
                .execute());

        reaper.sweep();

        List<QueueEntry> entries = queue.entriesFor(id);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).isClaimed()).isFalse();
        assertThat(entries.get(0).deliveries()).isEqualTo(1);
    }

    @Test
    void keepsFreshClaims() {
        String id = enqueuePending();
        queue.claimNext("busy-worker").orElseThrow();

        reaper.sweep();

        assertThat(queue.entriesFor(id)).singleElement().satisfies(e -> assertThat(e.isClaimed()).isTrue());
    }

    @Test
    void redeliveredPendingTaskStillRunsOnce() throws Exception {
        String id = enqueuePending();
        QueueEntry claimed = queue.claimNext("vanished-worker").orElseThrow();
        jdbi.useHandle(h -> h.createUpdate("UPDATE task_queue SET claimed_at = :at WHERE id = :id")
                .bind("at", Instant.now().minus(Duration.ofHours(1)))
                .bind("id", claimed.id())
                .execute());
        reaper.sweep();

        workerPool.start();

        assertThat(tasks.awaitTerminal(id, Duration.ofSeconds(10)).status()).isEqualTo(TaskStatus.COMPLETED);
    }

    // --- Expired processing tasks ---

    @Test
    void failsTaskWhoseWorkerDisappeared() {
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", "orphan"), "reaper");
        assertThat(store.markProcessing(id)).isTrue();
        tasks.backdate(id, Duration.ofHours(1));

        reaper.sweep();

        TaskRecord record = tasks.get(id);
        assertThat(record.status()).isEqualTo(TaskStatus.FAILED);
        TaskError error = store.error(record);
        assertThat(error.category()).isEqualTo(FailureCategory.TIMEOUT);
        assertThat(error.message()).isEqualTo("worker lease expired");
    }

    @Test
    void leavesRecentProcessingTaskAlone() {
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", "busy"), "reaper");
        assertThat(store.markProcessing(id)).isTrue();

        reaper.sweep();

        assertThat(tasks.get(id).status()).isEqualTo(TaskStatus.PROCESSING);
    }

    @Test
    void neverReturnsTasksToPending() {
        String id = tasks.insertPending("deepseek", "deepseek-chat", Map.of("prompt", "stuck"), "reaper");
        assertThat(store.markProcessing(id)).isTrue();
        tasks.backdate(id, Duration.ofDays(1));

        reaper.sweep();
        reaper.sweep();

        assertThat(tasks.get(id).status()).isEqualTo(TaskStatus.FAILED);
    }

    // --- Purge ---

    @Test
    void purgesEntriesOfFinishedTasks() {
        String cancelled = enqueuePending();
        String waiting = enqueuePending();
        assertThat(store.cancel(cancelled)).isTrue();

        reaper.sweep();

        assertThat(queue.entriesFor(cancelled)).isEmpty();
        assertThat(queue.entriesFor(waiting)).hasSize(1);
    }

    private String enqueuePending() {
        String id = tasks.insertPending("aliyun", "qwen-turbo", Map.of("prompt", "reap"), "reaper");
        jdbi.useTransaction(h -> queue.enqueue(h, id));
        return id;
    }
}
