package com.chunkvault.core.service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

/**
 * Base class for {@link ManagedService} implementations. Provides:
 * <ul>
 *   <li>Thread-safe state machine via {@link AtomicReference}</li>
 *   <li>CDI event firing on every state transition</li>
 *   <li>{@link #dependencies()} validation before start</li>
 * </ul>
 * Failure cascade is handled by {@link ServiceDependencyCascade} to avoid
 * circular bean creation during CDI event delivery.
 * <p>
 * Instances created outside CDI (unit tests, embedded use) work the same way;
 * state transitions are then only logged.
 * <p>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractManagedService implements ManagedService {

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    @Inject
    Event<ServiceStateChangedEvent> stateEvent;

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    /** Services that must be running before this one starts. */
    public List<ManagedService> dependencies() {
        return List.of();
    }

    // -- ManagedService contract --

    @Override
    public State state() {
        return state.get();
    }

    @Override
    public void start() throws Exception {
        if (state.get() == State.RUNNING) {
            return; // idempotent
        }

        verifyDependencies();

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void stop() throws Exception {
        if (state.get() == State.STOPPED) {
            return; // idempotent
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public void fail(Throwable cause) {
        State old = state.get();
        if (old == State.FAILED) {
            return; // already failed
        }
        log.errorf("Service '%s' failed (was %s): %s", serviceId(), old, cause.getMessage());
        transition(State.FAILED, cause.getMessage());
    }

    /**
     * Directly sets state without firing events or lifecycle callbacks.
     * Intended for test isolation: restores state after destructive tests.
     */
    public void forceState(State newState) {
        state.set(newState);
    }

    /** True when {@code serviceId} names one of this service's dependencies. */
    public boolean dependsOn(String serviceId) {
        for (ManagedService dep : dependencies()) {
            if (dep.serviceId().equals(serviceId)) {
                return true;
            }
        }
        return false;
    }

    // -- internals --

    private void transition(State newState) {
        transition(newState, null);
    }

    private void transition(State newState, String cause) {
        State old = state.getAndSet(newState);
        log.infof("Service '%s': %s -> %s", serviceId(), old, newState);
        if (stateEvent != null) {
            stateEvent.fire(new ServiceStateChangedEvent(
                    serviceId(), old, newState, Instant.now(), cause));
        }
    }

    private void verifyDependencies() {
        for (ManagedService dep : dependencies()) {
            if (!dep.isRunning()) {
                throw new IllegalStateException(
                        "Cannot start '" + serviceId() + "': dependency '"
                                + dep.serviceId() + "' is " + dep.state());
            }
        }
    }
}
