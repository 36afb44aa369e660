package com.libragraph.modelgate.core.dao;

import com.libragraph.modelgate.core.task.TaskFilter;
import com.libragraph.modelgate.core.task.TaskRecord;
import com.libragraph.modelgate.core.task.TaskStatus;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task persistence. Every state change is a conditional UPDATE guarded on the
 * expected current status; callers read the affected-row count to learn whether
 * they won the transition.
 */
@RegisterColumnMapper(TaskStatusColumnMapper.class)
@RegisterArgumentFactory(TaskStatusArgumentFactory.class)
@RegisterConstructorMapper(TaskRecord.class)
public interface TaskDao {

    @SqlUpdate("INSERT INTO task (id, model, provider, parameters, is_async, status, principal, " +
            "attempts, created_at, updated_at) " +
            "VALUES (:id, :model, :provider, :parameters, :async, :status, :principal, 0, :now, :now)")
    void insert(@Bind("id") String id,
                @Bind("model") String model,
                @Bind("provider") String provider,
                @Bind("parameters") String parameters,
                @Bind("async") boolean async,
                @Bind("status") TaskStatus status,
                @Bind("principal") String principal,
                @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM task WHERE id = :id")
    Optional<TaskRecord> findById(@Bind("id") String id);

    @SqlUpdate("UPDATE task SET status = :to, started_at = :now, updated_at = :now " +
            "WHERE id = :id AND status = :from")
    int transition(@Bind("id") String id,
                   @Bind("from") TaskStatus from,
                   @Bind("to") TaskStatus to,
                   @Bind("now") Instant now);

    @SqlUpdate("UPDATE task SET attempts = attempts + 1, updated_at = :now " +
            "WHERE id = :id AND status = :processing")
    int recordAttempt(@Bind("id") String id,
                      @Bind("processing") TaskStatus processing,
                      @Bind("now") Instant now);

    @SqlUpdate("UPDATE task SET status = :completed, result = :result, updated_at = :now, " +
            "completed_at = :now WHERE id = :id AND status = :processing")
    int complete(@Bind("id") String id,
                 @Bind("result") String result,
                 @Bind("processing") TaskStatus processing,
                 @Bind("completed") TaskStatus completed,
                 @Bind("now") Instant now);

    @SqlUpdate("UPDATE task SET status = :failed, error = :error, updated_at = :now, " +
            "completed_at = :now WHERE id = :id AND status = :processing")
    int fail(@Bind("id") String id,
             @Bind("error") String error,
             @Bind("processing") TaskStatus processing,
             @Bind("failed") TaskStatus failed,
             @Bind("now") Instant now);

    @SqlUpdate("UPDATE task SET status = :cancelled, updated_at = :now, completed_at = :now " +
            "WHERE id = :id AND status IN (:pending, :processing)")
    int cancel(@Bind("id") String id,
               @Bind("pending") TaskStatus pending,
               @Bind("processing") TaskStatus processing,
               @Bind("cancelled") TaskStatus cancelled,
               @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM task WHERE status = :status AND updated_at < :cutoff")
    List<TaskRecord> findStale(@Bind("status") TaskStatus status, @Bind("cutoff") Instant cutoff);

    /**
     * One page of tasks matching {@code filter}, newest first. Null filter fields
     * are not applied.
     */
    default List<TaskRecord> page(Handle handle, TaskFilter filter, int limit, long offset) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String where = TaskFilterClause.where(filter, binds);
        Query query = handle.createQuery("SELECT * FROM task" + where +
                        " ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset")
                .bind("limit", limit)
                .bind("offset", offset)
                .registerColumnMapper(new TaskStatusColumnMapper())
                .registerRowMapper(ConstructorMapper.factory(TaskRecord.class))
                .registerArgument(new TaskStatusArgumentFactory());
        binds.forEach(query::bind);
        return query.mapTo(TaskRecord.class).list();
    }

    default long count(Handle handle, TaskFilter filter) {
        Map<String, Object> binds = new LinkedHashMap<>();
        String where = TaskFilterClause.where(filter, binds);
        Query query = handle.createQuery("SELECT COUNT(*) FROM task" + where)
                .registerArgument(new TaskStatusArgumentFactory());
        binds.forEach(query::bind);
        return query.mapTo(Long.class).one();
    }
}
