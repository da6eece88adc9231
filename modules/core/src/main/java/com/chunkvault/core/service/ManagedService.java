package com.chunkvault.core.service;

/**
 * Engine component with a start/stop lifecycle. The write queue and the record store are
 * managed services; a service only starts once everything it depends on is running, and a
 * failure fails its dependants too.
 * State transitions fire {@link ServiceStateChangedEvent} via CDI.
 */
public interface ManagedService {

    enum State {
        STOPPED,
        STARTING,
        RUNNING,
        /** Draining: no new work is scheduled, queued work is finishing. */
        STOPPING,
        FAILED
    }

    String serviceId();

    State state();

    void start() throws Exception;

    /** Stops the service, letting it finish work it has already accepted. */
    void stop() throws Exception;

    void fail(Throwable cause);

    default boolean isRunning() {
        return state() == State.RUNNING;
    }

    default boolean isFailed() {
        return state() == State.FAILED;
    }
}
