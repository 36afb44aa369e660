package com.libragraph.modelgate.core.task;

/**
 * Listing criteria. A null field matches everything; a null {@code principal}
 * lists across all owners.
 */
public record TaskFilter(String principal, TaskStatus status, String model, String provider) {

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null);
    }

    public TaskFilter withPrincipal(String owner) {
        return new TaskFilter(owner, status, model, provider);
    }
}
