package org.cbqueue.api.resources;

import java.util.Map;

/**
 * An interface for components that can be monitored.
 * <p>
 * Queues and services expose their counters through this interface so that callers can poll
 * them without knowing the concrete type.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     * <p>
     * The keys are snake_case metric names (e.g., "elements_pushed", "current_size") and the
     * values are the corresponding numeric values.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy, false if it is in a degraded or stopped state.
     */
    boolean isHealthy();
}
