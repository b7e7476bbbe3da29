package com.libragraph.datasink.core.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.event.Event;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedService} implementations. Provides:
 * <ul>
 *   <li>an {@link AtomicReference} state machine</li>
 *   <li>a CDI event on every transition</li>
 *   <li>{@code @DependsOn} checks before start</li>
 *   <li>boot and shutdown hooks for {@code @PostConstruct}/{@code @PreDestroy}</li>
 * </ul>
 * Failure cascade lives in {@link ServiceDependencyCascade} so that event delivery
 * during {@code @PostConstruct} does not create beans recursively.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    @Inject
    Instance<ManagedService> allServices;

    protected final Logger log = Logger.getLogger(getClass());

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return;
        }

        verifyDependencies();

        transition(State.STARTING, null);
        try {
            doStart();
            transition(State.RUNNING, null);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return;
        }

        transition(State.STOPPING, null);
        try {
            doStop();
            transition(State.STOPPED, null);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return;
        }
        log.errorf(cause, "Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED, cause.getMessage());
    }

    /**
     * Sets state without firing events or running callbacks. For tests that
     * restore state after a destructive case.
     */
    public void forceState(State newState) {
        state.set(newState);
    }

    /** The {@code @DependsOn} classes declared on this service. */
    public List<Class<? extends ManagedService>> getDependencies() {
        List<Class<? extends ManagedService>> deps = new ArrayList<>();
        DependsOn[] annotations = getClass().getAnnotationsByType(DependsOn.class);
        for (DependsOn d : annotations) {
            deps.add(d.value());
        }
        return deps;
    }

    /**
     * Throws {@link ServiceUnavailableException} unless RUNNING. Accessors that hand
     * out the underlying resource call this first.
     */
    protected void requireRunning() {
        State current = state.get();
        if (current != State.RUNNING) {
            throw new ServiceUnavailableException(serviceId(), current);
        }
    }

    /** Starts the service from {@code @PostConstruct}, rethrowing unchecked. */
    protected void startOnBoot() {
        try {
            start();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Service '" + serviceId() + "' failed to start", e);
        }
    }

    /** Stops the service from {@code @PreDestroy}, logging instead of throwing. */
    protected void stopOnShutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warnf(e, "Error stopping service '%s'", serviceId());
        }
    }

    private void transition(State newState, String reason) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        stateEvent.fire(new ServiceStateChangedEvent(
                serviceId(), old, newState, reason, Instant.now()));
    }

    private void verifyDependencies() {
        for (Class<? extends ManagedService> dep : getDependencies()) {
            for (ManagedService svc : allServices) {
                if (dep.isInstance(svc) && !svc.isRunning()) {
                    throw new ServiceUnavailableException(svc.serviceId(), svc.state());
                }
            }
        }
    }
}
