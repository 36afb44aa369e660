package com.libragraph.modelgate.types;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Usage(
        @JsonProperty("prompt_tokens") long promptTokens,
        @JsonProperty("completion_tokens") long completionTokens,
        @JsonProperty("total_tokens") long totalTokens
) {
    public static final Usage EMPTY = new Usage(0, 0, 0);

    /** Builds usage, deriving the total when the vendor reports none. */
    public static Usage of(long promptTokens, long completionTokens, long totalTokens) {
        long total = totalTokens > 0 ? totalTokens : promptTokens + completionTokens;
        return new Usage(promptTokens, completionTokens, total);
    }
}
