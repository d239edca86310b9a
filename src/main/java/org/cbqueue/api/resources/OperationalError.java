package org.cbqueue.api.resources;

import java.time.Instant;

/**
 * A transient error recorded by a running component, kept for monitoring.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g., "HANDLER_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Additional context, such as the component name and exception message.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
