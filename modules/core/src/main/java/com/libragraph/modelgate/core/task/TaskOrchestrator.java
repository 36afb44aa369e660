package com.libragraph.modelgate.core.task;

import com.libragraph.modelgate.core.auth.Caller;
import com.libragraph.modelgate.core.error.InvalidStateException;
import com.libragraph.modelgate.core.error.TaskNotFoundException;
import com.libragraph.modelgate.core.error.ValidationException;
import com.libragraph.modelgate.core.provider.ModelProvider;
import com.libragraph.modelgate.core.provider.ProviderRegistry;
import com.libragraph.modelgate.core.queue.TaskQueue;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.UUID;

/**
 * Entry point for every task operation. Validation happens before anything is
 * persisted; reads are scoped to the caller's principal unless the caller has
 * system scope.
 */
@ApplicationScoped
public class TaskOrchestrator {

    private static final Logger log = Logger.getLogger(TaskOrchestrator.class);

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    @Inject
    Jdbi jdbi;

    @Inject
    TaskStore store;

    @Inject
    TaskQueue queue;

    @Inject
    TaskExecutor executor;

    @Inject
    ProviderRegistry providers;

    /**
     * Creates a task. Async tasks are queued and returned PENDING; sync tasks run
     * on the calling thread and come back terminal.
     *
     * @throws ValidationException for an unknown provider, unsupported model or
     *         malformed parameters
     */
    public TaskView create(CreateTaskCommand command, Caller caller) {
        validate(command);

        String id = UUID.randomUUID().toString();
        jdbi.useTransaction(handle -> {
            store.insert(handle, id, command.model(), command.provider(), command.parameters(),
                    command.async(), caller.principal());
            if (command.async()) {
                queue.enqueue(handle, id);
            }
        });
        log.infof("Created %s task %s (%s/%s) for %s", command.async() ? "async" : "sync",
                id, command.provider(), command.model(), caller.principal());

        if (command.async()) {
            queue.signalWork();
        } else {
            executor.execute(id);
        }
        return store.view(store.require(id));
    }

    public TaskView status(String taskId, Caller caller) {
        return store.view(visible(taskId, caller)).withoutOutcome();
    }

    public TaskResult result(String taskId, Caller caller) {
        TaskRecord record = visible(taskId, caller);
        return new TaskResult(record.id(), record.status(), store.result(record), store.error(record));
    }

    /**
     * Cancels a PENDING or PROCESSING task.
     *
     * @throws InvalidStateException when the task is already terminal
     */
    public TaskView cancel(String taskId, Caller caller) {
        TaskRecord record = visible(taskId, caller);
        if (record.status().isTerminal()) {
            throw new InvalidStateException("Cannot cancel task in status: " + record.status().label());
        }
        if (!store.cancel(taskId)) {
            TaskStatus now = store.require(taskId).status();
            throw new InvalidStateException("Cannot cancel task in status: " + now.label());
        }

        int withdrawn = queue.withdraw(taskId);
        boolean signalled = executor.signalCancel(taskId);
        log.infof("Task %s cancelled by %s (was %s, %d queue entries withdrawn, in-flight=%s)",
                taskId, caller.principal(), record.status().label(), withdrawn, signalled);
        return store.view(store.require(taskId));
    }

    /**
     * Lists tasks newest first.
     *
     * @throws ValidationException when {@code page} or {@code pageSize} is below 1;
     *         page sizes above {@link #MAX_PAGE_SIZE} are capped
     */
    public TaskPage list(TaskFilter filter, int page, int pageSize, Caller caller) {
        if (page < 1) {
            throw new ValidationException("page must be >= 1");
        }
        if (pageSize < 1) {
            throw new ValidationException("page_size must be >= 1");
        }
        TaskFilter scoped = caller.isSystem() ? filter : filter.withPrincipal(caller.principal());
        return store.page(scoped, page, Math.min(pageSize, MAX_PAGE_SIZE));
    }

    private void validate(CreateTaskCommand command) {
        if (command == null) {
            throw new ValidationException("Request body is required");
        }
        if (isBlank(command.provider())) {
            throw new ValidationException("provider is required");
        }
        if (isBlank(command.model())) {
            throw new ValidationException("model is required");
        }
        if (command.parameters() == null) {
            throw new ValidationException("parameters is required");
        }
        ModelProvider provider = providers.require(command.provider());
        provider.prepare(command.model(), command.parameters());
    }

    private TaskRecord visible(String taskId, Caller caller) {
        TaskRecord record = store.find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (!caller.canSee(record.principal())) {
            throw new TaskNotFoundException(taskId);
        }
        return record;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
