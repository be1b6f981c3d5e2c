package com.questrail.eventstream.codec;

import com.questrail.eventstream.internal.frame.HeaderValue;

import java.util.Map;

/**
 * EventStreamFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for event-stream frames.
 *
 * <p>This is the mechanical inverse of {@link EventStreamFrameDecoder}. It
 * writes a prelude with a valid CRC32C, the encoded headers, the payload as
 * given and the trailing message CRC32C.</p>
 */
public interface EventStreamFrameEncoder
{
    /**
     * Encode one frame.
     *
     * @param headers headers in the order they should appear on the wire
     * @param payload payload bytes, written verbatim
     * @return complete frame bytes
     * @throws IllegalArgumentException if a header cannot be represented on the
     *         wire or the frame would exceed the maximum frame length
     */
    byte[] encode(Map<String, HeaderValue> headers, byte[] payload);
}
