package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.codec.EventStreamFrameEncoder;
import com.questrail.eventstream.internal.frame.HeaderValue;

import java.util.Map;
import java.util.Objects;

import static com.questrail.eventstream.codec.impl.EventStreamFraming.MAX_MESSAGE_SIZE;
import static com.questrail.eventstream.codec.impl.EventStreamFraming.MESSAGE_CRC_SIZE;
import static com.questrail.eventstream.codec.impl.EventStreamFraming.PRELUDE_SIZE;

/**
 * DefaultEventStreamFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EventStreamFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultEventStreamFrameDecoder}.
 * Payload bytes are written as given; callers that want a compressed or
 * nested payload build it first.</p>
 */
public final class DefaultEventStreamFrameEncoder implements EventStreamFrameEncoder
{
    @Override
    public byte[] encode(Map<String, HeaderValue> headers, byte[] payload)
    {
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(payload, "payload");

        final byte[] headerBytes = EventStreamHeaderCodec.encode(headers);
        final long totalLength = (long) PRELUDE_SIZE + headerBytes.length + payload.length + MESSAGE_CRC_SIZE;
        if (totalLength > MAX_MESSAGE_SIZE) {
            throw new IllegalArgumentException("Frame of " + totalLength + " bytes exceeds " + MAX_MESSAGE_SIZE);
        }

        final byte[] frame = new byte[(int) totalLength];

        // ---------------------------------------------------------------------
        // 1) Prelude: [ total ][ headers length ][ prelude CRC ]
        // ---------------------------------------------------------------------

        EventStreamFraming.writeUInt32(frame, 0, totalLength);
        EventStreamFraming.writeUInt32(frame, 4, headerBytes.length);
        EventStreamFraming.writeUInt32(frame, 8, EventStreamCrc32c.checksum(frame, 0, 8));

        // ---------------------------------------------------------------------
        // 2) Headers and payload
        // ---------------------------------------------------------------------

        System.arraycopy(headerBytes, 0, frame, PRELUDE_SIZE, headerBytes.length);
        System.arraycopy(payload, 0, frame, PRELUDE_SIZE + headerBytes.length, payload.length);

        // ---------------------------------------------------------------------
        // 3) Message CRC over everything before it
        // ---------------------------------------------------------------------

        final int crcOffset = frame.length - MESSAGE_CRC_SIZE;
        EventStreamFraming.writeUInt32(frame, crcOffset, EventStreamCrc32c.checksum(frame, 0, crcOffset));
        return frame;
    }
}
