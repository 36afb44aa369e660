package com.libragraph.modelgate.core.task;

import com.libragraph.modelgate.core.db.DatabaseService;
import com.libragraph.modelgate.core.provider.FailureCategory;
import com.libragraph.modelgate.core.queue.TaskQueue;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Recovers from workers that died mid-task. Stale queue claims are released
 * for redelivery; PROCESSING tasks that outlived the time limit plus the claim
 * lease are failed, never put back to PENDING.
 */
@ApplicationScoped
public class TaskReaper {

    private static final Logger log = Logger.getLogger(TaskReaper.class);

    static final String LEASE_EXPIRED = "worker lease expired";

    @Inject
    TaskStore store;

    @Inject
    TaskQueue queue;

    @Inject
    DatabaseService database;

    @ConfigProperty(name = "modelgate.tasks.claim-lease", defaultValue = "PT5M")
    Duration claimLease;

    @ConfigProperty(name = "modelgate.tasks.time-limit", defaultValue = "PT5M")
    Duration timeLimit;

    @Scheduled(every = "${modelgate.tasks.reaper-interval:30s}", concurrentExecution = SKIP)
    public void sweep() {
        if (!database.isRunning()) {
            log.debug("Database not running, skipping sweep");
            return;
        }
        Instant now = Instant.now();
        releaseStaleClaims(now);
        failExpiredTasks(now);
        purgeFinishedEntries();
    }

    int releaseStaleClaims(Instant now) {
        int released = queue.releaseClaimsOlderThan(now.minus(claimLease));
        if (released > 0) {
            log.warnf("Released %d stale queue claims (lease %s)", released, claimLease);
        }
        return released;
    }

    int failExpiredTasks(Instant now) {
        Instant cutoff = now.minus(timeLimit).minus(claimLease);
        int failed = 0;
        for (TaskRecord task : store.findStaleProcessing(cutoff)) {
            if (store.fail(task.id(), TaskError.of(FailureCategory.TIMEOUT, LEASE_EXPIRED))) {
                failed++;
                log.warnf("Task %s (%s/%s) processing since %s, marked FAILED: %s",
                        task.id(), task.provider(), task.model(), task.startedAt(), LEASE_EXPIRED);
            }
        }
        return failed;
    }

    int purgeFinishedEntries() {
        int purged = queue.purgeTerminal();
        if (purged > 0) {
            log.debugf("Purged %d queue entries of finished tasks", purged);
        }
        return purged;
    }
}
