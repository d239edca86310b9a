package org.cbqueue.api.queues;

/**
 * Outcome of a queue operation.
 * <p>
 * Every expected condition is reported through this status rather than an exception.
 * Only {@link #SUCCESS} means the queue was mutated (push or pop) or the output was populated;
 * every other value guarantees that neither happened.
 */
public enum QueueStatus {
    /**
     * The operation completed exactly as requested.
     */
    SUCCESS,
    /**
     * The queue was, or became, interrupted during the call. Also returned when the calling
     * thread itself is interrupted while waiting.
     */
    INTERRUPTED,
    /**
     * The configured timeout elapsed before enough elements became available.
     */
    TIMEOUT,
    /**
     * Fewer elements than requested were available when the call resolved.
     */
    INSUFFICIENT_ELEMENTS
}
