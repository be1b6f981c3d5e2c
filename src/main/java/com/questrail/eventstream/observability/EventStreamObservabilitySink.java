package com.questrail.eventstream.observability;

import com.questrail.eventstream.internal.frame.EventStreamFrame;

/**
 * Main interface for receiving event-stream decoder observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked synchronously on the thread driving the decoder.</p>
 */
public interface EventStreamObservabilitySink {
    /**
     * Called when a complete top-level frame has been extracted.
     * @param frame the frame as decoded, before nested unwrapping
     */
    void onFrameDecoded(EventStreamFrame frame);

    /**
     * Called when one byte was discarded after a format error.
     * @param event the resync details
     */
    void onResync(EventStreamResyncEvent event);

    /**
     * Called when a gzip-marked payload could not be decompressed and the raw
     * bytes were kept.
     * @param event the failure details
     */
    void onPayloadFallback(EventStreamErrorEvent event);

    /**
     * Called when an error or anomaly occurs in the decoding stack.
     * @param event the error event
     */
    void onError(EventStreamErrorEvent event);
}
