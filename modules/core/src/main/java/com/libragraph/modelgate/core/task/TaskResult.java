package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.modelgate.types.ChatCompletion;

/**
 * Outcome of a result lookup. Exactly one of {@code result} and {@code error}
 * is set for finished tasks; neither for pending, processing or cancelled ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("result") ChatCompletion result,
        @JsonProperty("error") TaskError error
) {
    @JsonIgnore
    public boolean isReady() {
        return status == TaskStatus.COMPLETED || status == TaskStatus.FAILED;
    }

    public String describe() {
        return switch (status) {
            case COMPLETED -> "Task completed";
            case FAILED -> "Task failed";
            case CANCELLED -> "Task was cancelled";
            case PENDING, PROCESSING -> "Task not ready";
        };
    }
}
