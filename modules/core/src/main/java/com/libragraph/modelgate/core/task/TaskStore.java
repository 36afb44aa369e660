package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.modelgate.core.dao.TaskDao;
import com.libragraph.modelgate.core.error.InternalException;
import com.libragraph.modelgate.core.error.TaskNotFoundException;
import com.libragraph.modelgate.types.ChatCompletion;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the {@code task} table. Transition methods return whether the
 * guarded UPDATE matched, i.e. whether the caller won the transition.
 */
@ApplicationScoped
public class TaskStore {

    private static final TypeReference<Map<String, Object>> PARAMETERS = new TypeReference<>() {};

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    /** Inserts a PENDING task within the caller's transaction. */
    public void insert(Handle handle, String id, String model, String provider,
                       Map<String, Object> parameters, boolean async, String principal) {
        handle.attach(TaskDao.class).insert(id, model, provider, toJson(parameters), async,
                TaskStatus.PENDING, principal, Instant.now());
    }

    public Optional<TaskRecord> find(String id) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findById(id));
    }

    public TaskRecord require(String id) {
        return find(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    public boolean markProcessing(String id) {
        return jdbi.withExtension(TaskDao.class, dao ->
                dao.transition(id, TaskStatus.PENDING, TaskStatus.PROCESSING, Instant.now())) == 1;
    }

    public boolean recordAttempt(String id) {
        return jdbi.withExtension(TaskDao.class, dao ->
                dao.recordAttempt(id, TaskStatus.PROCESSING, Instant.now())) == 1;
    }

    public boolean complete(String id, ChatCompletion result) {
        String json = toJson(result);
        return jdbi.withExtension(TaskDao.class, dao ->
                dao.complete(id, json, TaskStatus.PROCESSING, TaskStatus.COMPLETED, Instant.now())) == 1;
    }

    public boolean fail(String id, TaskError error) {
        String json = toJson(error);
        return jdbi.withExtension(TaskDao.class, dao ->
                dao.fail(id, json, TaskStatus.PROCESSING, TaskStatus.FAILED, Instant.now())) == 1;
    }

    public boolean cancel(String id) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.cancel(id,
                TaskStatus.PENDING, TaskStatus.PROCESSING, TaskStatus.CANCELLED, Instant.now())) == 1;
    }

    /** Tasks still PROCESSING whose last update predates {@code cutoff}. */
    public List<TaskRecord> findStaleProcessing(Instant cutoff) {
        return jdbi.withExtension(TaskDao.class, dao -> dao.findStale(TaskStatus.PROCESSING, cutoff));
    }

    /** Pages past the last matching task come back empty. */
    public TaskPage page(TaskFilter filter, int page, int pageSize) {
        long offset = (long) (page - 1) * pageSize;
        return jdbi.inTransaction(handle -> {
            TaskDao dao = handle.attach(TaskDao.class);
            long total = dao.count(handle, filter);
            if (offset >= total) {
                return new TaskPage(List.of(), total, page, pageSize);
            }
            List<TaskSummary> items = dao.page(handle, filter, pageSize, offset).stream()
                    .map(TaskSummary::of)
                    .toList();
            return new TaskPage(items, total, page, pageSize);
        });
    }

    public Map<String, Object> parameters(TaskRecord record) {
        return fromJson(record.parameters(), PARAMETERS);
    }

    public ChatCompletion result(TaskRecord record) {
        return record.result() == null ? null : fromJson(record.result(), new TypeReference<ChatCompletion>() {});
    }

    public TaskError error(TaskRecord record) {
        return record.error() == null ? null : fromJson(record.error(), new TypeReference<TaskError>() {});
    }

    public TaskView view(TaskRecord record) {
        return TaskView.of(record, result(record), error(record));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InternalException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new InternalException("Corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
