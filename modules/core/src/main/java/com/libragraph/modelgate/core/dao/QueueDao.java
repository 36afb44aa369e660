package com.libragraph.modelgate.core.dao;

import com.libragraph.modelgate.core.queue.QueueEntry;
import com.libragraph.modelgate.core.task.TaskStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@RegisterArgumentFactory(TaskStatusArgumentFactory.class)
@RegisterConstructorMapper(QueueEntry.class)
public interface QueueDao {

    @SqlUpdate("INSERT INTO task_queue (task_id, enqueued_at, deliveries) VALUES (:taskId, :now, 0)")
    void enqueue(@Bind("taskId") String taskId, @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM task_queue WHERE claimed_by IS NULL ORDER BY id LIMIT :limit")
    List<QueueEntry> findUnclaimed(@Bind("limit") int limit);

    @SqlQuery("SELECT * FROM task_queue WHERE task_id = :taskId ORDER BY id")
    List<QueueEntry> findByTask(@Bind("taskId") String taskId);

    /** Returns 1 when this worker won the entry, 0 when another worker got there first. */
    @SqlUpdate("UPDATE task_queue SET claimed_by = :worker, claimed_at = :now, deliveries = deliveries + 1 " +
            "WHERE id = :id AND claimed_by IS NULL")
    int claim(@Bind("id") long id, @Bind("worker") String worker, @Bind("now") Instant now);

    @SqlUpdate("DELETE FROM task_queue WHERE id = :id")
    int delete(@Bind("id") long id);

    @SqlUpdate("DELETE FROM task_queue WHERE task_id = :taskId AND claimed_by IS NULL")
    int deleteUnclaimed(@Bind("taskId") String taskId);

    @SqlUpdate("UPDATE task_queue SET claimed_by = NULL, claimed_at = NULL " +
            "WHERE claimed_by IS NOT NULL AND claimed_at < :cutoff")
    int releaseClaimsBefore(@Bind("cutoff") Instant cutoff);

    @SqlUpdate("DELETE FROM task_queue WHERE task_id IN " +
            "(SELECT id FROM task WHERE status IN (<statuses>))")
    int deleteForTasksIn(@BindList("statuses") Collection<TaskStatus> statuses);

    @SqlQuery("SELECT COUNT(*) FROM task_queue")
    long count();
}
