package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.modelgate.types.ChatCompletion;

import java.time.Instant;

/**
 * Client-facing snapshot of a task. {@code result} is present only when
 * COMPLETED and {@code error} only when FAILED.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskView(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("model") String model,
        @JsonProperty("provider") String provider,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("is_async") boolean async,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("result") ChatCompletion result,
        @JsonProperty("error") TaskError error
) {
    static TaskView of(TaskRecord record, ChatCompletion result, TaskError error) {
        return new TaskView(record.id(), record.model(), record.provider(), record.status(),
                record.async(), record.attempts(), record.createdAt(), record.updatedAt(),
                record.startedAt(), record.completedAt(), result, error);
    }

    /** The same snapshot without result or error, as reported by the status route. */
    public TaskView withoutOutcome() {
        return new TaskView(taskId, model, provider, status, async, attempts,
                createdAt, updatedAt, startedAt, completedAt, null, null);
    }
}
