package com.libragraph.modelgate.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Envelope for every response body: {@code {success, message, results}}.
 */
public record ApiResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("results") Object results
) {
    public static ApiResponse ok(String message, Object results) {
        return new ApiResponse(true, message, results);
    }

    public static ApiResponse error(String message, String errorLabel) {
        return new ApiResponse(false, message, Map.of("error", errorLabel));
    }
}
