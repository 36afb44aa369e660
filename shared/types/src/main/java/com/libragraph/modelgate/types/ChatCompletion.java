package com.libragraph.modelgate.types;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Unified response schema. Every provider reply is normalized into this shape
 * regardless of the vendor's native format.
 *
 * @param created epoch seconds
 */
public record ChatCompletion(
        @JsonProperty("id") String id,
        @JsonProperty("model") String model,
        @JsonProperty("created") long created,
        @JsonProperty("choices") List<Choice> choices,
        @JsonProperty("usage") Usage usage
) {
    public ChatCompletion {
        choices = choices == null ? List.of() : List.copyOf(choices);
        usage = usage == null ? Usage.EMPTY : usage;
    }

    /** First choice's message, if the vendor returned any. */
    @JsonIgnore
    public ChatMessage firstMessage() {
        return choices.isEmpty() ? null : choices.get(0).message();
    }
}
