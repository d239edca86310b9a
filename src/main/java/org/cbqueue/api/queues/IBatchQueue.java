package org.cbqueue.api.queues;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * An unbounded FIFO queue shared between producer and consumer threads, supporting single and
 * batch operations, a queue-wide timeout for blocking waits and a sticky interrupted flag that
 * releases all waiters.
 * <p>
 * Implementations must be thread-safe. Expected failures are returned as {@link QueueStatus}
 * values; unchecked exceptions are reserved for programming errors such as {@code null}
 * elements or negative counts, and are thrown before any state change.
 *
 * @param <T> The type of elements held in this queue.
 */
public interface IBatchQueue<T> {

    /**
     * Appends one element to the tail of the queue. Never blocks.
     *
     * @param value The element to append.
     * @return {@link QueueStatus#SUCCESS}, or {@link QueueStatus#INTERRUPTED} if the queue is interrupted.
     * @throws NullPointerException if {@code value} is null.
     */
    QueueStatus pushOne(T value);

    /**
     * Appends all elements in iteration order as one atomic step. An empty batch is a no-op that
     * returns {@link QueueStatus#SUCCESS}. Never blocks.
     *
     * @param values The elements to append.
     * @return {@link QueueStatus#SUCCESS}, or {@link QueueStatus#INTERRUPTED} if the queue is interrupted.
     * @throws NullPointerException if {@code values} is null or contains a null element.
     */
    QueueStatus pushBatch(Iterable<? extends T> values);

    /**
     * Removes the front element and hands it to {@code output}.
     *
     * @param output   Receives the element, only on {@link QueueStatus#SUCCESS}.
     * @param blocking Whether to wait for an element to become available.
     * @return The outcome of the call.
     */
    QueueStatus popOne(Consumer<? super T> output, boolean blocking);

    /**
     * Blocking variant of {@link #popOne(Consumer, boolean)}.
     */
    default QueueStatus popOne(Consumer<? super T> output) {
        return popOne(output, true);
    }

    /**
     * Removes exactly {@code count} front elements and adds them to {@code destination} in FIFO
     * order, or removes nothing. A blocking call waits until {@code count} elements are
     * available at once, so no other consumer can split the batch.
     *
     * @param destination Receives the elements, only on {@link QueueStatus#SUCCESS}.
     * @param count       Number of elements to remove; zero is a no-op.
     * @param blocking    Whether to wait for enough elements.
     * @return The outcome of the call.
     * @throws IllegalArgumentException if {@code count} is negative.
     */
    QueueStatus popBatch(Collection<? super T> destination, int count, boolean blocking);

    /**
     * Blocking variant of {@link #popBatch(Collection, int, boolean)}.
     */
    default QueueStatus popBatch(Collection<? super T> destination, int count) {
        return popBatch(destination, count, true);
    }

    /**
     * Hands the front element to {@code output} without removing it.
     *
     * @param output   Receives the element, only on {@link QueueStatus#SUCCESS}.
     * @param blocking Whether to wait for an element to become available.
     * @return The outcome of the call.
     */
    QueueStatus getFront(Consumer<? super T> output, boolean blocking);

    /**
     * Blocking variant of {@link #getFront(Consumer, boolean)}.
     */
    default QueueStatus getFront(Consumer<? super T> output) {
        return getFront(output, true);
    }

    /**
     * Adds the first {@code count} elements to {@code destination} without removing them.
     *
     * @param destination Receives the elements, only on {@link QueueStatus#SUCCESS}.
     * @param count       Number of elements to read; zero is a no-op.
     * @param blocking    Whether to wait for enough elements.
     * @return The outcome of the call.
     * @throws IllegalArgumentException if {@code count} is negative.
     */
    QueueStatus getFrontBatch(Collection<? super T> destination, int count, boolean blocking);

    /**
     * Blocking variant of {@link #getFrontBatch(Collection, int, boolean)}.
     */
    default QueueStatus getFrontBatch(Collection<? super T> destination, int count) {
        return getFrontBatch(destination, count, true);
    }

    /**
     * @return The timeout applied to every blocking wait, or empty if waits never expire.
     */
    Optional<Duration> getTimeoutDuration();

    /**
     * Sets the timeout for blocking waits. A wait already in progress keeps the value it
     * sampled when it started.
     *
     * @param duration The new timeout, or {@code null} to wait indefinitely.
     * @throws IllegalArgumentException if {@code duration} is negative.
     */
    void setTimeoutDuration(Duration duration);

    boolean isInterrupted();

    /**
     * Sets or clears the interrupted flag. Setting it wakes every blocked waiter, which then
     * returns {@link QueueStatus#INTERRUPTED}. Clearing it wakes nobody.
     *
     * @param value The new flag value.
     */
    void setInterrupted(boolean value);

    int size();

    boolean isEmpty();

    /**
     * Removes all elements. Leaves the interrupted flag and the timeout untouched and does not
     * wake waiters.
     */
    void clear();
}
