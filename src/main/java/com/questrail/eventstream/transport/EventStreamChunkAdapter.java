package com.questrail.eventstream.transport;

import com.questrail.eventstream.api.EventStreamEvent;
import com.questrail.eventstream.internal.decode.EventStreamDecoder;
import com.questrail.eventstream.internal.frame.EventStreamFrame;
import com.questrail.eventstream.mapping.EventStreamEventMapper;
import com.questrail.eventstream.observability.EventStreamErrorEvent;
import com.questrail.eventstream.observability.EventStreamObservabilitySink;
import com.questrail.eventstream.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * EventStreamChunkAdapter
 * =============================================================================
 * Connects a chunked byte source to application event delivery.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   onChunk(bytes)
 *        → EventStreamDecoder.feed / frames
 *            → EventStreamEventMapper.toEvent
 *                → Consumer&lt;EventStreamEvent&gt;
 * </pre>
 *
 * <p>One adapter serves exactly one stream. Events are handed to the consumer
 * on the calling thread, in stream order, before {@link #onChunk} returns.</p>
 *
 * <p>Decoder failures (buffer limit, strict-mode format errors) propagate to
 * the caller, which decides whether to drop the connection. Events decoded
 * ahead of the failure have already been delivered.</p>
 */
public class EventStreamChunkAdapter implements ByteChunkListener {

    private final EventStreamDecoder decoder;
    private final EventStreamEventMapper mapper;
    private final Consumer<EventStreamEvent> consumer;
    private final EventStreamObservabilitySink sink;

    public EventStreamChunkAdapter(EventStreamDecoder decoder,
                                   EventStreamEventMapper mapper,
                                   Consumer<EventStreamEvent> consumer) {
        this(decoder, mapper, consumer, NullObservabilitySink.INSTANCE);
    }

    public EventStreamChunkAdapter(EventStreamDecoder decoder,
                                   EventStreamEventMapper mapper,
                                   Consumer<EventStreamEvent> consumer,
                                   EventStreamObservabilitySink sink) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void onChunk(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");

        decoder.feed(chunk);

        Iterator<EventStreamFrame> frames = decoder.frames();
        while (frames.hasNext()) {
            consumer.accept(mapper.toEvent(frames.next()));
        }
    }

    @Override
    public void onStreamEnd(Throwable cause) {
        final int leftover = decoder.bufferedBytes();
        if (leftover > 0) {
            sink.onError(new EventStreamErrorEvent(
                    Instant.now(),
                    "Stream ended with " + leftover + " undecoded bytes",
                    null));
        }
        if (cause != null) {
            sink.onError(new EventStreamErrorEvent(Instant.now(), "Stream failed", cause));
        }
        decoder.reset();
    }
}
