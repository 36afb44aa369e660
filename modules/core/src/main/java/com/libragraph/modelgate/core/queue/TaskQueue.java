package com.libragraph.modelgate.core.queue;

import com.libragraph.modelgate.core.dao.QueueDao;
import com.libragraph.modelgate.core.task.TaskStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Durable queue of task ids backed by the {@code task_queue} table.
 * <p>
 * An entry is delivered to at most one worker at a time: claiming is a
 * conditional UPDATE on {@code claimed_by IS NULL}. Entries are deleted once the
 * worker has finished with the task; a claim left behind by a dead worker is
 * released by the reaper and the entry is redelivered.
 */
@ApplicationScoped
public class TaskQueue {

    private static final Logger log = Logger.getLogger(TaskQueue.class);

    private static final EnumSet<TaskStatus> TERMINAL =
            EnumSet.of(TaskStatus.COMPLETED, TaskStatus.FAILED, TaskStatus.CANCELLED);

    @Inject
    Jdbi jdbi;

    @ConfigProperty(name = "modelgate.queue.batch-size", defaultValue = "8")
    int batchSize;

    private final Semaphore workAvailable = new Semaphore(0);

    /** Adds an entry within the caller's transaction. Call {@link #signalWork()} after commit. */
    public void enqueue(Handle handle, String taskId) {
        handle.attach(QueueDao.class).enqueue(taskId, Instant.now());
    }

    public void signalWork() {
        workAvailable.release();
    }

    /** Blocks until work is signalled or the timeout elapses. */
    public boolean awaitWork(long timeout, TimeUnit unit) throws InterruptedException {
        return workAvailable.tryAcquire(timeout, unit);
    }

    /** Releases {@code waiters} parked workers, used on shutdown. */
    public void wakeAll(int waiters) {
        workAvailable.release(waiters);
    }

    /** Clears stale wakeups left from a previous run. */
    public void resetSignals() {
        workAvailable.drainPermits();
    }

    /**
     * Claims the oldest unclaimed entry for {@code workerId}. Candidates lost to a
     * concurrent worker are skipped.
     */
    public Optional<QueueEntry> claimNext(String workerId) {
        return jdbi.withExtension(QueueDao.class, dao -> {
            List<QueueEntry> candidates = dao.findUnclaimed(batchSize);
            for (QueueEntry candidate : candidates) {
                Instant now = Instant.now();
                if (dao.claim(candidate.id(), workerId, now) == 1) {
                    log.debugf("Worker %s claimed queue entry %d (task %s, delivery #%d)",
                            workerId, candidate.id(), candidate.taskId(), candidate.deliveries() + 1);
                    return Optional.of(new QueueEntry(candidate.id(), candidate.taskId(),
                            candidate.enqueuedAt(), workerId, now, candidate.deliveries() + 1));
                }
            }
            return Optional.empty();
        });
    }

    public void acknowledge(QueueEntry entry) {
        jdbi.useExtension(QueueDao.class, dao -> dao.delete(entry.id()));
    }

    /** Removes entries for {@code taskId} that no worker has claimed yet. */
    public int withdraw(String taskId) {
        return jdbi.withExtension(QueueDao.class, dao -> dao.deleteUnclaimed(taskId));
    }

    public int releaseClaimsOlderThan(Instant cutoff) {
        return jdbi.withExtension(QueueDao.class, dao -> dao.releaseClaimsBefore(cutoff));
    }

    /** Deletes every entry whose task already reached a terminal state. */
    public int purgeTerminal() {
        return jdbi.withExtension(QueueDao.class, dao -> dao.deleteForTasksIn(TERMINAL));
    }

    public List<QueueEntry> entriesFor(String taskId) {
        return jdbi.withExtension(QueueDao.class, dao -> dao.findByTask(taskId));
    }

    public long size() {
        return jdbi.withExtension(QueueDao.class, QueueDao::count);
    }
}
