package com.questrail.eventstream.observability;

import com.questrail.eventstream.codec.EventStreamFormatException;

import java.time.Instant;

/**
 * Record emitted each time the streaming decoder discards one byte to
 * recover from malformed input.
 *
 * @param timestamp     when the skip happened
 * @param bufferedBytes bytes still buffered after the skip
 * @param cause         the format error that triggered the skip
 */
public record EventStreamResyncEvent(
    Instant timestamp,
    int bufferedBytes,
    EventStreamFormatException cause
) {
}
