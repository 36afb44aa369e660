package com.libragraph.modelgate.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single message in a normalized choice.
 * <p>
 * {@code reasoningContent} and {@code toolCalls} are vendor extras that are
 * carried through verbatim when present and omitted from JSON otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        @JsonProperty("role") String role,
        @JsonProperty("content") String content,
        @JsonProperty("reasoning_content") String reasoningContent,
        @JsonProperty("tool_calls") JsonNode toolCalls
) {
    public static final String ASSISTANT = "assistant";

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content, null, null);
    }
}
