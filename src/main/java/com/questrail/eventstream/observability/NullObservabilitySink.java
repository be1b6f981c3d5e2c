package com.questrail.eventstream.observability;

import com.questrail.eventstream.internal.frame.EventStreamFrame;

/**
 * No-op implementation of EventStreamObservabilitySink.
 */
public final class NullObservabilitySink implements EventStreamObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrameDecoded(EventStreamFrame frame) {}

    @Override
    public void onResync(EventStreamResyncEvent event) {}

    @Override
    public void onPayloadFallback(EventStreamErrorEvent event) {}

    @Override
    public void onError(EventStreamErrorEvent event) {}
}
