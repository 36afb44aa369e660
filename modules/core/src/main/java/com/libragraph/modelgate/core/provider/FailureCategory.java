package com.libragraph.modelgate.core.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why a provider invocation failed. Transient categories are retried by the
 * executor; every other category fails the task on first occurrence.
 */
public enum FailureCategory {
    AUTHENTICATION("authentication", false),
    QUOTA("quota", false),
    MALFORMED_REQUEST("malformed_request", false),
    TIMEOUT("timeout", true),
    NETWORK("network", true),
    UPSTREAM_UNAVAILABLE("upstream_unavailable", true),
    CONFIGURATION("configuration", false),
    MALFORMED_RESPONSE("malformed_response", false),
    INTERNAL("internal", false);

    private final String label;
    private final boolean transientFailure;

    FailureCategory(String label, boolean transientFailure) {
        this.label = label;
        this.transientFailure = transientFailure;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    /** Maps a non-2xx vendor status code to a category. */
    public static FailureCategory forHttpStatus(int status) {
        if (status == 401 || status == 403) return AUTHENTICATION;
        if (status == 429) return QUOTA;
        if (status == 408) return TIMEOUT;
        if (status >= 500) return UPSTREAM_UNAVAILABLE;
        return MALFORMED_REQUEST;
    }

    @JsonCreator
    public static FailureCategory fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (FailureCategory c : values()) {
            if (c.label.equals(normalized)) return c;
        }
        throw new IllegalArgumentException("Unknown FailureCategory: " + label);
    }
}
