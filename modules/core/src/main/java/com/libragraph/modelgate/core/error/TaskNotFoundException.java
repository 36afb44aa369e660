package com.libragraph.modelgate.core.error;

/**
 * Thrown when a lookup targets a task that does not exist or is not visible to the caller.
 */
public class TaskNotFoundException extends ModelGateException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
