package org.cbqueue.services;

import com.typesafe.config.Config;
import org.cbqueue.api.resources.IMonitorable;
import org.cbqueue.api.resources.OperationalError;
import org.cbqueue.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An abstract base class for services, providing lifecycle management on a dedicated thread,
 * pause support and error tracking. Subclasses implement {@link #run()}.
 * <p>
 * Error Tracking: Services use {@link #recordError(String, String, String)} for transient
 * errors that do not require the service to stop.
 */
public abstract class AbstractService implements IService, IMonitorable {

    private static final long STOP_JOIN_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final Object pauseLock = new Object();
    private volatile Thread serviceThread;

    /**
     * Bounded by {@link #getMaxErrors()}; oldest entries are dropped first.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * @param name    The name of the service instance, also used as thread name.
     * @param options The configuration for this service.
     */
    protected AbstractService(String name, Config options) {
        this.serviceName = Objects.requireNonNull(name, "Service name cannot be null");
        this.options = Objects.requireNonNull(options, "Service options cannot be null");
    }

    /**
     * Maximum number of errors kept in memory. Subclasses can override this value.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    public String getServiceName() {
        return serviceName;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        Thread thread = new Thread(this::runService);
        thread.setName(serviceName);
        serviceThread = thread;
        thread.start();
        logStarted();
    }

    /**
     * Logs service startup. Services can override this to include their settings.
     */
    protected void logStarted() {
        log.info("{} '{}' started", this.getClass().getSimpleName(), serviceName);
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING && state != State.PAUSED) {
            throw new IllegalStateException(String.format("Cannot stop service '%s' as it is in state %s", serviceName, state));
        }

        if (state == State.PAUSED) {
            synchronized (pauseLock) {
                pauseLock.notifyAll();
            }
        }

        Thread thread = serviceThread;
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(STOP_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for service '{}' to stop", serviceName);
            }

            if (thread.isAlive()) {
                log.error("Service '{}' did not stop within {} ms, forcing ERROR state", serviceName, STOP_JOIN_TIMEOUT_MS);
                currentState.set(State.ERROR);
                return;
            }
        }

        // runService() sets STOPPED on exit; this covers a thread that never got scheduled
        if (getCurrentState() != State.STOPPED && getCurrentState() != State.ERROR) {
            currentState.set(State.STOPPED);
        }
        log.debug("Service '{}' stopped", serviceName);
    }

    @Override
    public final void pause() {
        if (!currentState.compareAndSet(State.RUNNING, State.PAUSED)) {
            throw new IllegalStateException(String.format("Cannot pause service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("Service '{}' paused", serviceName);
    }

    @Override
    public final void resume() {
        if (!currentState.compareAndSet(State.PAUSED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot resume service '%s' as it is in state %s", serviceName, getCurrentState()));
        }
        log.info("Service '{}' resumed", serviceName);
        synchronized (pauseLock) {
            pauseLock.notifyAll();
        }
    }

    @Override
    public void restart() {
        if (getCurrentState() == State.RUNNING || getCurrentState() == State.PAUSED) {
            stop();
        }
        if (getCurrentState() == State.ERROR) {
            throw new IllegalStateException(String.format("Cannot restart service '%s' as it is in state ERROR", serviceName));
        }
        start();
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Wraps {@link #run()} with state management.
     * <ul>
     *   <li>Normal return or InterruptedException: STOPPED</li>
     *   <li>Any other exception: ERROR, stack trace at DEBUG</li>
     * </ul>
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread '{}' interrupted, shutting down.", serviceName);
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Service '{}' stopped with ERROR due to {}: {}", serviceName, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for '{}' has terminated.", serviceName);
        }
    }

    /**
     * The main logic of the service, executed on the service thread. Implementations should
     * call {@link #checkPause()} regularly and return when the thread is interrupted.
     * <p>
     * <strong>Error Handling Guidelines:</strong>
     * <ul>
     *   <li>Transient errors: {@code log.warn(...)} without the exception, then
     *       {@link #recordError(String, String, String)}, then continue.</li>
     *   <li>Fatal errors: throw; the service moves to ERROR.</li>
     *   <li>Shutdown: let {@link InterruptedException} propagate or simply return.</li>
     * </ul>
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Blocks the current thread while the service is PAUSED.
     *
     * @throws InterruptedException if the thread is interrupted while waiting.
     */
    protected void checkPause() throws InterruptedException {
        synchronized (pauseLock) {
            while (getCurrentState() == State.PAUSED) {
                log.debug("Service '{}' is paused, waiting...", serviceName);
                pauseLock.wait();
            }
        }
    }

    /**
     * Records a transient error. Not for fatal errors or interruption, see {@link #run()}.
     *
     * @param code    Error code for categorization (e.g., "HANDLER_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * A service is healthy unless it is in ERROR state or has recorded errors.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) {
            return false;
        }
        return errors.isEmpty();
    }

    /**
     * Returns {@code error_count} followed by the metrics added in {@link #addCustomMetrics(Map)}.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for service-specific metrics. Always call {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already holding the base metrics
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
