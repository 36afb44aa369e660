package com.libragraph.modelgate.core.service;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State holder for {@link ManagedService}s. Subclasses supply {@link #doStart()}
 * and {@link #doStop()}; recovery reuses {@link #doStart()}.
 * Failure and recovery propagation to dependants lives in {@link ServiceDependencyCascade}.
 */
public abstract class AbstractManagedService implements ManagedService {

    protected final Logger log = Logger.getLogger(getClass());

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private volatile Throwable failureCause;

    @Inject
    Event<ServiceTransition> transitions;

    @Inject
    Instance<ManagedService> services;

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public synchronized void start() throws Exception {
        if (isRunning()) {
            return;
        }
        Optional<ManagedService> blocker = unavailableDependency();
        if (blocker.isPresent()) {
            throw new IllegalStateException("Cannot start '" + serviceId() + "': dependency '"
                    + blocker.get().serviceId() + "' is " + blocker.get().state());
        }

        moveTo(State.STARTING, null);
        try {
            doStart();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        failureCause = null;
        moveTo(State.RUNNING, null);
    }

    @Override
    public synchronized void stop() throws Exception {
        if (state() == State.STOPPED) {
            return;
        }
        moveTo(State.STOPPING, null);
        try {
            doStop();
        } catch (Exception e) {
            fail(e);
            throw e;
        }
        moveTo(State.STOPPED, null);
    }

    @Override
    public void fail(Throwable cause) {
        if (state().isFailed()) {
            return;
        }
        failureCause = cause;
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), state(), cause.getMessage());
        moveTo(State.FAILED, String.valueOf(cause.getMessage()));
    }

    @Override
    public synchronized boolean recover() {
        if (!state().isFailed()) {
            return isRunning();
        }
        Optional<ManagedService> blocker = unavailableDependency();
        if (blocker.isPresent()) {
            log.debugf("Service '%s' stays FAILED: dependency '%s' is %s",
                    serviceId(), blocker.get().serviceId(), blocker.get().state());
            return false;
        }
        try {
            doStart();
        } catch (Exception e) {
            failureCause = e;
            log.warnf("Service '%s' recovery failed: %s", serviceId(), e.getMessage());
            return false;
        }
        Throwable previous = failureCause;
        failureCause = null;
        log.infof("Service '%s' recovered", serviceId());
        moveTo(State.RUNNING, previous != null ? "recovered from: " + previous.getMessage() : "recovered");
        return true;
    }

    /** Cause of the current failure, or null while healthy. */
    public Throwable failureCause() {
        return failureCause;
    }

    /** Whether {@code other} is one of this service's {@link DependsOn} targets. */
    public boolean dependsOn(ManagedService other) {
        return dependencies().stream().anyMatch(type -> type.isInstance(other));
    }

    /**
     * Sets state without events or callbacks. Tests use it to put a service back
     * after a destructive scenario.
     */
    public void forceState(State newState) {
        state.set(newState);
    }

    private List<Class<? extends ManagedService>> dependencies() {
        DependsOn declared = getClass().getAnnotation(DependsOn.class);
        return declared == null ? List.of() : Arrays.asList(declared.value());
    }

    private Optional<ManagedService> unavailableDependency() {
        for (ManagedService svc : services) {
            if (dependsOn(svc) && !svc.isRunning()) {
                return Optional.of(svc);
            }
        }
        return Optional.empty();
    }

    private void moveTo(State next, String reason) {
        State previous = state.getAndSet(next);
        log.infof("Service '%s': %s -> %s", serviceId(), previous, next);
        transitions.fire(new ServiceTransition(serviceId(), previous, next, reason, Instant.now()));
    }
}
