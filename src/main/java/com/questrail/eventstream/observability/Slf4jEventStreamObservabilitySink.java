package com.questrail.eventstream.observability;

import com.questrail.eventstream.internal.frame.EventStreamFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of EventStreamObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jEventStreamObservabilitySink implements EventStreamObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jEventStreamObservabilitySink.class);

    @Override
    public void onFrameDecoded(EventStreamFrame frame) {
        if (log.isTraceEnabled()) {
            log.trace("Event-stream frame decoded: {}", frame);
        }
    }

    @Override
    public void onResync(EventStreamResyncEvent event) {
        log.debug("Event-stream resync: skipped 1 byte, {} buffered ({})",
            event.bufferedBytes(),
            event.cause().getMessage());
    }

    @Override
    public void onPayloadFallback(EventStreamErrorEvent event) {
        log.debug("Event-stream payload kept raw: {}", event.message(), event.cause());
    }

    @Override
    public void onError(EventStreamErrorEvent event) {
        if (event.cause() != null) {
            log.warn("Event-stream error: {}", event.message(), event.cause());
        } else {
            log.warn("Event-stream error: {}", event.message());
        }
    }
}
