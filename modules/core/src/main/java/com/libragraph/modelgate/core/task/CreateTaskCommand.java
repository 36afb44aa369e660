package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request to run one completion. {@code parameters} is passed to the provider
 * as-is after validation.
 */
public record CreateTaskCommand(
        @JsonProperty("model") String model,
        @JsonProperty("provider") String provider,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("is_async") boolean async
) {}
