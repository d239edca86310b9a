package org.cbqueue.api.services;

import org.cbqueue.api.resources.OperationalError;

import java.util.List;

/**
 * A long-running component that works on its own thread, typically consuming from a queue.
 * Each service has a well-defined lifecycle (start, stop, pause, resume).
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /**
         * The service is not running and must be started to become active.
         */
        STOPPED,
        /**
         * The service is actively processing data.
         */
        RUNNING,
        /**
         * The service is temporarily suspended but can resume its work.
         */
        PAUSED,
        /**
         * The service has encountered a fatal error and cannot continue.
         */
        ERROR
    }

    /**
     * Starts the service, transitioning it to the RUNNING state.
     *
     * @throws IllegalStateException if the service is not STOPPED.
     */
    void start();

    /**
     * Stops the service, transitioning it to the STOPPED state.
     *
     * @throws IllegalStateException if the service is neither RUNNING nor PAUSED.
     */
    void stop();

    /**
     * Pauses the service, transitioning it to the PAUSED state.
     */
    void pause();

    /**
     * Resumes a paused service, transitioning it back to the RUNNING state.
     */
    void resume();

    State getCurrentState();

    /**
     * Restarts the service as a stop() followed by a start().
     */
    void restart();

    /**
     * @return The transient errors recorded since the last {@link #clearErrors()}.
     */
    List<OperationalError> getErrors();

    void clearErrors();
}
