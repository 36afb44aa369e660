package com.libragraph.modelgate.core.task;

import com.libragraph.modelgate.core.db.DatabaseService;
import com.libragraph.modelgate.core.queue.QueueEntry;
import com.libragraph.modelgate.core.queue.TaskQueue;
import com.libragraph.modelgate.core.service.AbstractManagedService;
import com.libragraph.modelgate.core.service.DependsOn;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of workers draining the {@link TaskQueue}. The pool size bounds the
 * number of async provider calls in flight on this node.
 */
@ApplicationScoped
@Startup
@DependsOn(DatabaseService.class)
public class TaskWorkerPool extends AbstractManagedService {

    @Inject
    TaskQueue queue;

    @Inject
    TaskExecutor executor;

    @ConfigProperty(name = "modelgate.tasks.worker-count", defaultValue = "4")
    int workerCount;

    @ConfigProperty(name = "modelgate.tasks.poll-interval", defaultValue = "PT1S")
    Duration pollInterval;

    @ConfigProperty(name = "modelgate.cluster.node-id", defaultValue = "localhost")
    String nodeId;

    private ExecutorService workers;
    private volatile boolean running;

    @Override
    public String serviceId() {
        return "task-worker-pool";
    }

    @Override
    protected void doStart() {
        if (workers != null && !workers.isShutdown()) {
            // threads left over from a failed run
            workers.shutdownNow();
        }
        running = true;
        queue.resetSignals();

        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(workerCount, runnable -> {
            Thread thread = new Thread(runnable, "task-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workerCount; i++) {
            String workerId = nodeId + "-worker-" + i;
            workers.submit(() -> workerLoop(workerId));
        }

        log.infof("TaskWorkerPool started with %d workers on node %s", workerCount, nodeId);
    }

    @Override
    protected void doStop() throws InterruptedException {
        running = false;
        queue.wakeAll(workerCount);
        if (workers != null) {
            workers.shutdownNow();
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate within 5s");
            }
        }
        log.info("TaskWorkerPool stopped");
    }

    /** Stops claiming work as soon as the pool, or the database it depends on, fails. */
    @Override
    public void fail(Throwable cause) {
        running = false;
        queue.wakeAll(workerCount);
        super.fail(cause);
    }

    private void workerLoop(String workerId) {
        while (running) {
            try {
                Optional<QueueEntry> claimed = queue.claimNext(workerId);
                if (claimed.isPresent()) {
                    process(claimed.get());
                } else {
                    queue.awaitWork(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                if (running) {
                    log.error("Unexpected error in worker loop", e);
                    try {
                        Thread.sleep(1000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
    }

    /** An entry is acknowledged only after execution returns; a crash leaves the claim for the reaper. */
    private void process(QueueEntry entry) {
        ExecutionOutcome outcome = executor.execute(entry.taskId());
        queue.acknowledge(entry);
        log.debugf("Queue entry %d (task %s) acknowledged: %s", entry.id(), entry.taskId(), outcome);
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("TaskWorkerPool failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping TaskWorkerPool", e);
        }
    }
}
