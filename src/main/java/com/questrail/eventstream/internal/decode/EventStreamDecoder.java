package com.questrail.eventstream.internal.decode;

import com.questrail.eventstream.codec.EventStreamFormatException;
import com.questrail.eventstream.codec.EventStreamFrameDecoder;
import com.questrail.eventstream.codec.impl.DefaultEventStreamFrameDecoder;
import com.questrail.eventstream.codec.impl.EventStreamFraming;
import com.questrail.eventstream.config.EventStreamDecoderConfig;
import com.questrail.eventstream.internal.frame.EventStreamFrame;
import com.questrail.eventstream.observability.EventStreamErrorEvent;
import com.questrail.eventstream.observability.EventStreamObservabilitySink;
import com.questrail.eventstream.observability.EventStreamResyncEvent;
import com.questrail.eventstream.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * EventStreamDecoder
 * ============================================================================
 * Incremental decoder for one logical event-stream byte stream.
 *
 * <h2>Architectural Role</h2>
 * Accepts raw chunks split at arbitrary boundaries and yields complete
 * {@link EventStreamFrame}s as soon as enough bytes are buffered.
 *
 * <pre>
 *   feed(chunk) → DecoderBuffer
 *   decode()    → EventStreamFrameDecoder.extract(buffer start)
 *                   ok          → drop consumedBytes, yield frame (nested unwrapped)
 *                   incomplete  → stop, wait for the next feed
 *                   format error→ drop 1 byte, retry (resync)
 * </pre>
 *
 * <h2>State</h2>
 * The only state is the owned buffer. Each call to {@link #decode()} or
 * {@link #frames()} works on whatever is buffered at that moment and resumes
 * correctly after a later {@link #feed(byte[])}.
 *
 * <h2>Threading</h2>
 * Not thread-safe. Callers serialize {@code feed}/{@code decode} per stream.
 *
 * <h2>Failure policy</h2>
 * By default format errors are never surfaced: the decoder favors liveness
 * and resynchronizes one byte at a time. With
 * {@link EventStreamDecoderConfig#strict()} the byte is still skipped, then the
 * error is thrown as {@link EventStreamDecodeException}.
 */
public final class EventStreamDecoder
{
    private final EventStreamFrameDecoder frameDecoder;
    private final EventStreamDecoderConfig config;
    private final EventStreamObservabilitySink sink;

    private final DecoderBuffer buffer = new DecoderBuffer();

    public EventStreamDecoder() {
        this(EventStreamDecoderConfig.defaults());
    }

    public EventStreamDecoder(EventStreamDecoderConfig config) {
        this(config, NullObservabilitySink.INSTANCE);
    }

    public EventStreamDecoder(EventStreamDecoderConfig config, EventStreamObservabilitySink sink) {
        this(new DefaultEventStreamFrameDecoder(config, sink), config, sink);
    }

    public EventStreamDecoder(EventStreamFrameDecoder frameDecoder,
                              EventStreamDecoderConfig config,
                              EventStreamObservabilitySink sink) {
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Appends a chunk to the buffer.
     *
     * @throws EventStreamDecodeException if the buffer would exceed
     *         {@link EventStreamDecoderConfig#maxBufferSize()}; the buffer is
     *         left unchanged
     */
    public void feed(byte[] chunk) {
        Objects.requireNonNull(chunk, "chunk");
        feed(chunk, 0, chunk.length);
    }

    public void feed(byte[] chunk, int offset, int length) {
        Objects.requireNonNull(chunk, "chunk");
        if ((long) buffer.readable() + length > config.maxBufferSize()) {
            EventStreamDecodeException e = new EventStreamDecodeException(
                    "Buffer limit exceeded: " + buffer.readable() + " buffered + " + length
                            + " fed > " + config.maxBufferSize());
            sink.onError(new EventStreamErrorEvent(Instant.now(), e.getMessage(), null));
            throw e;
        }
        buffer.append(chunk, offset, length);
    }

    /**
     * Extracts every frame that is complete in the current buffer.
     *
     * @return frames in stream order; empty if none is complete yet
     * @throws EventStreamDecodeException in strict mode, on the first format
     *         error; frames extracted earlier in the same call are discarded,
     *         so strict callers that need them should pull from {@link #frames()}
     */
    public List<EventStreamFrame> decode() {
        List<EventStreamFrame> frames = new ArrayList<>();
        frames().forEachRemaining(frames::add);
        return frames;
    }

    /**
     * Returns a pull-based view over the buffered frames. Each
     * {@code hasNext()} that needs a new frame performs one extraction and
     * mutates the buffer. The iterator ends once the buffer holds no
     * complete frame; a fresh iterator picks up after the next feed.
     */
    public Iterator<EventStreamFrame> frames() {
        return new Iterator<>() {
            private EventStreamFrame next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    next = nextFrame();
                }
                return next != null;
            }

            @Override
            public EventStreamFrame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                EventStreamFrame frame = next;
                next = null;
                return frame;
            }
        };
    }

    /**
     * Number of bytes currently buffered and not yet consumed.
     */
    public int bufferedBytes() {
        return buffer.readable();
    }

    /**
     * Discards all buffered bytes.
     */
    public void reset() {
        buffer.clear();
    }

    private EventStreamFrame nextFrame() {
        while (buffer.readable() >= EventStreamFraming.MIN_MESSAGE_SIZE) {
            final Optional<EventStreamFrame> extracted;
            try {
                extracted = frameDecoder.extract(buffer.array(), buffer.readerOffset(), buffer.readable());
            } catch (EventStreamFormatException e) {
                buffer.skip(1);
                sink.onResync(new EventStreamResyncEvent(Instant.now(), buffer.readable(), e));
                if (config.strict()) {
                    throw new EventStreamDecodeException("Malformed event-stream frame: " + e.getMessage(), e);
                }
                continue;
            }

            if (extracted.isEmpty()) {
                return null;
            }

            final EventStreamFrame frame = extracted.get();
            buffer.skip(frame.consumedBytes());
            sink.onFrameDecoded(frame);

            // Nesting is unwrapped one level at this boundary.
            return frame.nested().orElse(frame);
        }
        return null;
    }
}
