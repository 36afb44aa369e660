package com.libragraph.modelgate.core.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthDecision(
        @JsonProperty("allowed") boolean allowed,
        @JsonProperty("principal") String principal,
        @JsonProperty("scope") CallerScope scope
) {
    public static AuthDecision deny() {
        return new AuthDecision(false, null, CallerScope.USER);
    }
}
