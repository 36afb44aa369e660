package com.libragraph.modelgate.core.db;

import com.libragraph.modelgate.core.dao.DatabaseDao;
import com.libragraph.modelgate.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Availability gate for the database holding both the task table and the queue.
 * <p>
 * Only the periodic {@link #checkConnectivity()} changes state: it fails the
 * service after {@code modelgate.database.failure-threshold} consecutive failed
 * checks, and recovers it (and with it the worker pool) on the first successful
 * check afterwards. Health endpoints call {@link #isReachable()}, which only
 * reads.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    @Inject
    Jdbi jdbi;

    @ConfigProperty(name = "modelgate.database.failure-threshold", defaultValue = "3")
    int failureThreshold;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile String version;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() throws SQLException {
        version = jdbi.withHandle(handle -> {
            DatabaseMetaData meta = handle.getConnection().getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
        });
        consecutiveFailures.set(0);
        log.infof("Connected to: %s", version);
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Runs SELECT 1. Never changes the service state. */
    public boolean isReachable() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            log.debugf("Database ping failed: %s", e.getMessage());
            return false;
        }
    }

    @Scheduled(every = "${modelgate.database.check-interval:15s}", concurrentExecution = SKIP)
    public void checkConnectivity() {
        if (isReachable()) {
            consecutiveFailures.set(0);
            if (state().isFailed()) {
                recover();
            }
            return;
        }
        int failures = consecutiveFailures.incrementAndGet();
        log.warnf("Database connectivity check failed (%d/%d)", failures, failureThreshold);
        if (isRunning() && failures >= failureThreshold) {
            fail(new IllegalStateException("Database unreachable for " + failures + " consecutive checks"));
        }
    }

    /** Product name and version read when the service last started. */
    public String version() {
        return version;
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
