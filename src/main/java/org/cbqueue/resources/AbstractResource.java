package org.cbqueue.resources;

import com.typesafe.config.Config;
import org.cbqueue.api.resources.IMonitorable;
import org.cbqueue.api.resources.IResource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract base class for all IResource implementations, providing common
 * functionality for name and configuration handling, and the metrics template.
 */
public abstract class AbstractResource implements IResource, IMonitorable {
    protected final String resourceName;
    protected final Config options;

    /**
     * Constructor for AbstractResource.
     *
     * @param name    The unique name of the resource instance.
     * @param options The configuration object for this resource instance.
     */
    protected AbstractResource(String name, Config options) {
        this.resourceName = Objects.requireNonNull(name, "Resource name cannot be null");
        this.options = Objects.requireNonNull(options, "Resource options cannot be null");
    }

    @Override
    public String getResourceName() {
        return resourceName;
    }

    /**
     * Returns the configuration object for this resource.
     *
     * @return The configuration object.
     */
    public Config getOptions() {
        return options;
    }

    /**
     * Returns metrics for this resource.
     * <p>
     * Subclasses contribute their own metrics through {@link #addCustomMetrics(Map)}. The
     * returned map preserves insertion order.
     *
     * @return Map of metric names to their current values
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add resource-specific metrics.
     * <p>
     * <strong>IMPORTANT:</strong> Always call {@code super.addCustomMetrics(metrics)} first
     * so that metrics of intermediate classes are kept.
     *
     * @param metrics Mutable map to add custom metrics to
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + resourceName + "]";
    }
}
