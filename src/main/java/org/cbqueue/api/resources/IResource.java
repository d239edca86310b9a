package org.cbqueue.api.resources;

/**
 * Base interface for shared, named components such as queues.
 * <p>
 * A resource is created once and handed to every service that produces into or consumes from
 * it. The name identifies it in configuration, logs and metrics.
 */
public interface IResource {

    /**
     * The operational state of a resource.
     */
    enum ResourceState {
        /**
         * The resource holds data and is ready to serve consumers.
         */
        ACTIVE,
        /**
         * The resource is functioning but consumers would currently wait (e.g., queue empty).
         */
        WAITING,
        /**
         * The resource has been interrupted and rejects all operations until reset.
         */
        INTERRUPTED
    }

    /**
     * @return The unique name of this resource.
     */
    String getResourceName();

    /**
     * Returns a snapshot of the current state of the resource.
     *
     * @return The current {@link ResourceState}.
     */
    ResourceState getState();
}
