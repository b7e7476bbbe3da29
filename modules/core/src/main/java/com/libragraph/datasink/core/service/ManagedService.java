package com.libragraph.datasink.core.service;

/**
 * A startable part of datasink with an observable lifecycle: the graph store,
 * the content database of the {@code jdbc} backend, and the catalog engine.
 * Every transition fires a {@link ServiceStateChangedEvent}. HTTP requests that
 * reach a service outside RUNNING get {@link ServiceUnavailableException}.
 */
public interface ManagedService {

    enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    /** Stable id used in logs and state events, e.g. {@code graph-store}. */
    String serviceId();

    State state();

    void start() throws Exception;

    void stop() throws Exception;

    /** Moves to FAILED and cascades to dependents. No-op when already FAILED. */
    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }

    default boolean isFailed() {
        return state() == State.FAILED;
    }
}
