package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.modelgate.core.provider.FailureCategory;

/**
 * Categorized error recorded on a failed task.
 */
public record TaskError(
        @JsonProperty("category") FailureCategory category,
        @JsonProperty("message") String message,
        @JsonProperty("retryable") boolean retryable
) {
    public static TaskError of(FailureCategory category, String message) {
        return new TaskError(category, message, category.isTransient());
    }
}
