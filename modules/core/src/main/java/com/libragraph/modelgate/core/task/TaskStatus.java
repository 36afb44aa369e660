package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Task lifecycle states. Persisted by {@link #id()}, rendered by {@link #label()}.
 * <pre>
 *   PENDING -> PROCESSING -> COMPLETED | FAILED
 *   PENDING | PROCESSING -> CANCELLED
 * </pre>
 * COMPLETED, FAILED and CANCELLED are terminal. The transitions are enforced by
 * the conditional updates in {@code TaskDao}.
 */
public enum TaskStatus {
    PENDING(0, "pending"),
    PROCESSING(1, "processing"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed"),
    CANCELLED(4, "cancelled");

    private final int id;
    private final String label;

    TaskStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static TaskStatus fromId(int id) {
        for (TaskStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown TaskStatus id: " + id);
    }

    public static Optional<TaskStatus> fromLabel(String label) {
        if (label == null) return Optional.empty();
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus s : values()) {
            if (s.label.equals(normalized)) return Optional.of(s);
        }
        return Optional.empty();
    }
}
