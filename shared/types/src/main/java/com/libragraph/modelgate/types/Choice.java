package com.libragraph.modelgate.types;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Choice(
        @JsonProperty("index") int index,
        @JsonProperty("message") ChatMessage message,
        @JsonProperty("finish_reason") String finishReason
) {}
