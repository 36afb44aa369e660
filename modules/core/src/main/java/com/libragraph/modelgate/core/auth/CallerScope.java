package com.libragraph.modelgate.core.auth;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** SYSTEM callers see every task; USER callers only their own. */
public enum CallerScope {
    SYSTEM("system"),
    USER("user");

    private final String label;

    CallerScope(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Unknown or missing scopes degrade to USER. */
    @JsonCreator
    public static CallerScope fromLabel(String label) {
        return label != null && SYSTEM.label.equals(label.trim().toLowerCase(Locale.ROOT)) ? SYSTEM : USER;
    }
}
