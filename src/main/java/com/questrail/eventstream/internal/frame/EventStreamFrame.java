package com.questrail.eventstream.internal.frame;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * EventStreamFrame
 * -----------------------------------------------------------------------------
 * Immutable, decoded representation of one event-stream frame.
 *
 * <h2>What this represents</h2>
 * A frame after:
 * <ul>
 *   <li>the prelude lengths have been validated</li>
 *   <li>the header region has been decoded into typed values</li>
 *   <li>the payload has been decompressed (when it was gzip and decompression
 *       succeeded)</li>
 * </ul>
 *
 * <h2>Payload vs. nested</h2>
 * A frame whose {@code :content-type} marks a nested event-stream owns a
 * {@link #nested()} frame and an empty payload, unless its payload held no
 * complete inner frame, in which case it has neither. Every other frame owns
 * a payload (possibly empty) and no nested frame.
 *
 * <p>Frames hold no reference to the buffer they were decoded from.</p>
 */
public final class EventStreamFrame
{
    public static final String CONTENT_TYPE_HEADER = ":content-type";
    public static final String EVENT_TYPE_HEADER = ":event-type";
    public static final String MESSAGE_TYPE_HEADER = ":message-type";

    private final Map<String, HeaderValue> headers;

    /**
     * Payload bytes (never null; empty for nested frames).
     */
    private final byte[] payload;

    private final EventStreamFrame nested;

    /**
     * Declared total length of this frame on the wire.
     */
    private final int consumedBytes;

    private EventStreamFrame(Map<String, HeaderValue> headers,
                             byte[] payload,
                             EventStreamFrame nested,
                             int consumedBytes) {
        Objects.requireNonNull(headers, "headers");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.payload = (payload == null) ? new byte[0] : payload.clone();
        this.nested = nested;
        this.consumedBytes = consumedBytes;
    }

    /**
     * Creates a frame that owns a payload.
     */
    public static EventStreamFrame withPayload(Map<String, HeaderValue> headers,
                                               byte[] payload,
                                               int consumedBytes) {
        return new EventStreamFrame(headers, payload, null, consumedBytes);
    }

    /**
     * Creates a frame that wraps a nested event-stream frame.
     */
    public static EventStreamFrame withNested(Map<String, HeaderValue> headers,
                                              EventStreamFrame nested,
                                              int consumedBytes) {
        return new EventStreamFrame(headers, null, Objects.requireNonNull(nested, "nested"), consumedBytes);
    }

    /**
     * Returns the headers in wire order. Duplicate names keep the last value.
     */
    public Map<String, HeaderValue> headers() {
        return headers;
    }

    public Optional<HeaderValue> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    /**
     * Returns the value of a string-typed header, or empty if the header is
     * absent or carries a different type.
     */
    public Optional<String> stringHeader(String name) {
        HeaderValue value = headers.get(name);
        if (value instanceof HeaderValue.StringValue s) {
            return Optional.of(s.value());
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of the payload bytes.
     */
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadLength() {
        return payload.length;
    }

    public Optional<EventStreamFrame> nested() {
        return Optional.ofNullable(nested);
    }

    public boolean isNested() {
        return nested != null;
    }

    public int consumedBytes() {
        return consumedBytes;
    }

    @Override
    public String toString() {
        return "EventStreamFrame[" +
                "headers=" + headers.keySet() +
                ", payloadLength=" + payload.length +
                ", nested=" + (nested != null) +
                ", consumedBytes=" + consumedBytes +
                ']';
    }
}
