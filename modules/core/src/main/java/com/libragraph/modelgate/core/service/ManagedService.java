package com.libragraph.modelgate.core.service;

/**
 * Infrastructure whose availability decides whether tasks can run: the shared
 * database and the worker pool that drains the queue. A FAILED service can be
 * brought back with {@link #recover()}; every state change is published as a
 * {@link ServiceTransition}.
 */
public interface ManagedService {

    enum State {
        STOPPED, STARTING, RUNNING, STOPPING, FAILED;

        public boolean isFailed() {
            return this == FAILED;
        }
    }

    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    void fail(Throwable cause);

    /**
     * Restarts a FAILED service in place. No-op for any other state.
     *
     * @return whether the service is RUNNING afterwards
     */
    boolean recover();

    default boolean isRunning() {
        return state() == State.RUNNING;
    }
}
