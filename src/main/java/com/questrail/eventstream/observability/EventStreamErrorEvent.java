package com.questrail.eventstream.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the event-stream decoding stack.
 */
public record EventStreamErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
