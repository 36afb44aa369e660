package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TaskSummary(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("model") String model,
        @JsonProperty("provider") String provider,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("is_async") boolean async,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    static TaskSummary of(TaskRecord record) {
        return new TaskSummary(record.id(), record.model(), record.provider(), record.status(),
                record.async(), record.createdAt(), record.updatedAt());
    }
}
