package org.cbqueue.api.services;

import java.util.List;

/**
 * Receives the batches a {@link org.cbqueue.services.QueueWorker} pops from its queue.
 *
 * @param <T> The element type of the queue.
 */
@FunctionalInterface
public interface IBatchHandler<T> {

    /**
     * Processes one batch. The list is immutable and in FIFO order.
     * <p>
     * Any exception other than {@link InterruptedException} is treated as a transient failure
     * of this batch; the worker records it and keeps consuming.
     *
     * @param batch The popped elements, never empty.
     * @throws Exception if processing fails.
     */
    void handle(List<T> batch) throws Exception;
}
