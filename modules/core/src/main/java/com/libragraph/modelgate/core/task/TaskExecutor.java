package com.libragraph.modelgate.core.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.modelgate.core.provider.FailureCategory;
import com.libragraph.modelgate.core.provider.ModelProvider;
import com.libragraph.modelgate.core.provider.ProviderException;
import com.libragraph.modelgate.core.provider.ProviderRegistry;
import com.libragraph.modelgate.types.ChatCompletion;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task to a terminal state. Shared by the worker pool (async tasks) and
 * the orchestrator (sync tasks run on the request thread).
 * <p>
 * Only the caller whose {@code PENDING -> PROCESSING} update matches proceeds;
 * any other delivery is a no-op. Cancellation is checked before every attempt
 * and again after the provider returns, so a late reply is discarded rather
 * than persisted.
 */
@ApplicationScoped
public class TaskExecutor {

    private static final Logger log = Logger.getLogger(TaskExecutor.class);

    @Inject
    TaskStore store;

    @Inject
    ProviderRegistry providers;

    @ConfigProperty(name = "modelgate.tasks.time-limit", defaultValue = "PT5M")
    Duration timeLimit;

    @ConfigProperty(name = "modelgate.tasks.invoke-timeout")
    Optional<Duration> invokeTimeout;

    @ConfigProperty(name = "modelgate.tasks.retry.max-attempts", defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(name = "modelgate.tasks.retry.initial-delay", defaultValue = "PT0.5S")
    Duration initialDelay;

    @ConfigProperty(name = "modelgate.tasks.retry.multiplier", defaultValue = "2.0")
    double multiplier;

    @ConfigProperty(name = "modelgate.tasks.retry.max-delay", defaultValue = "PT10S")
    Duration maxDelay;

    private RetryPolicy retryPolicy;
    private ExecutorService invoker;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        retryPolicy = new RetryPolicy(maxAttempts, initialDelay, multiplier, maxDelay);
        invoker = Executors.newCachedThreadPool(namedDaemonThreads("provider-call-"));
        log.infof("TaskExecutor ready (invoke timeout %s, %s)", effectiveInvokeTimeout(), retryPolicy);
    }

    @PreDestroy
    void shutdown() {
        invoker.shutdownNow();
    }

    /**
     * Executes {@code taskId} if it is still PENDING.
     *
     * @return the outcome; {@link ExecutionOutcome.Skipped} when another delivery
     *         already took the task or it was cancelled while queued
     */
    public ExecutionOutcome execute(String taskId) {
        if (!store.markProcessing(taskId)) {
            TaskStatus found = store.find(taskId).map(TaskRecord::status).orElse(null);
            log.debugf("Task %s is %s, dropping delivery", taskId, found);
            return new ExecutionOutcome.Skipped(found);
        }

        InFlight flight = new InFlight();
        inFlight.put(taskId, flight);
        try {
            return run(store.require(taskId), flight);
        } finally {
            inFlight.remove(taskId);
        }
    }

    /**
     * Signals a task running on this node to stop. Best effort: the provider call
     * is interrupted and any reply that still arrives is discarded.
     *
     * @return whether the task was running here
     */
    public boolean signalCancel(String taskId) {
        InFlight flight = inFlight.get(taskId);
        if (flight == null) {
            return false;
        }
        flight.cancel();
        log.debugf("Cancel signalled to in-flight task %s", taskId);
        return true;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Duration effectiveInvokeTimeout() {
        return invokeTimeout.orElse(timeLimit);
    }

    private ExecutionOutcome run(TaskRecord task, InFlight flight) {
        Optional<ModelProvider> resolved = providers.lookup(task.provider());
        if (resolved.isEmpty()) {
            return fail(task, TaskError.of(FailureCategory.CONFIGURATION,
                    "Provider '" + task.provider() + "' is no longer configured"));
        }
        ModelProvider provider = resolved.get();
        Map<String, Object> parameters = store.parameters(task);

        int attempts = 0;
        while (true) {
            if (isCancelled(task.id(), flight) || !store.recordAttempt(task.id())) {
                return cancelled(task);
            }
            attempts++;

            try {
                JsonNode reply = invokeBounded(provider, task, parameters, flight);
                if (isCancelled(task.id(), flight)) {
                    log.infof("Task %s cancelled during provider call, reply discarded", task.id());
                    return cancelled(task);
                }
                ChatCompletion completion = provider.normalize(task.model(), reply);
                if (!store.complete(task.id(), completion)) {
                    return cancelled(task);
                }
                log.infof("Task %s completed (%s/%s, attempt %d, %d tokens)", task.id(), task.provider(),
                        task.model(), attempts, completion.usage().totalTokens());
                return new ExecutionOutcome.Completed(completion);
            } catch (CancellationException e) {
                return cancelled(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(task, TaskError.of(FailureCategory.INTERNAL, "Execution interrupted"));
            } catch (Exception e) {
                ProviderException failure = ProviderException.classify(e);
                if (failure.isTransient() && retryPolicy.allowsAnotherAttempt(attempts)) {
                    Duration delay = retryPolicy.delayAfter(attempts);
                    log.warnf("Task %s attempt %d/%d failed (%s): %s; retrying in %d ms", task.id(), attempts,
                            retryPolicy.maxAttempts(), failure.category().label(), failure.getMessage(),
                            delay.toMillis());
                    backoff(flight, delay);
                    continue;
                }
                if (failure.category() == FailureCategory.INTERNAL) {
                    log.errorf(e, "Task %s failed unexpectedly", task.id());
                }
                return fail(task, TaskError.of(failure.category(), failure.getMessage()));
            }
        }
    }

    private JsonNode invokeBounded(ModelProvider provider, TaskRecord task, Map<String, Object> parameters,
                                   InFlight flight)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<JsonNode> call = invoker.submit(() -> provider.invoke(task.model(), parameters));
        flight.attach(call);
        try {
            return call.get(effectiveInvokeTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            call.cancel(true);
            throw e;
        } finally {
            flight.attach(null);
        }
    }

    private boolean isCancelled(String taskId, InFlight flight) {
        return flight.isCancelled()
                || store.find(taskId).map(r -> r.status() == TaskStatus.CANCELLED).orElse(true);
    }

    private void backoff(InFlight flight, Duration delay) {
        try {
            flight.awaitCancel(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ExecutionOutcome fail(TaskRecord task, TaskError error) {
        if (!store.fail(task.id(), error)) {
            return cancelled(task);
        }
        log.warnf("Task %s failed (%s): %s", task.id(), error.category().label(), error.message());
        return new ExecutionOutcome.Failed(error);
    }

    private ExecutionOutcome cancelled(TaskRecord task) {
        log.debugf("Task %s stopped: no longer processing", task.id());
        return new ExecutionOutcome.Cancelled();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class InFlight {

        private final CountDownLatch cancelled = new CountDownLatch(1);
        private volatile Future<?> call;

        void attach(Future<?> current) {
            this.call = current;
            if (current != null && isCancelled()) {
                current.cancel(true);
            }
        }

        void cancel() {
            cancelled.countDown();
            Future<?> current = call;
            if (current != null) {
                current.cancel(true);
            }
        }

        boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        void awaitCancel(Duration delay) throws InterruptedException {
            cancelled.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
