package com.libragraph.modelgate.core.task;

import com.libragraph.modelgate.types.ChatCompletion;

/**
 * What one delivery of a task amounted to.
 */
public sealed interface ExecutionOutcome {

    record Completed(ChatCompletion result) implements ExecutionOutcome {}

    record Failed(TaskError error) implements ExecutionOutcome {}

    /** The task was cancelled before or during execution; any reply was discarded. */
    record Cancelled() implements ExecutionOutcome {}

    /** The task was not PENDING when delivered, so nothing ran. */
    record Skipped(TaskStatus found) implements ExecutionOutcome {}
}
