package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.config.EventStreamDecoderConfig;

/**
 * EventStreamFraming
 * -----------------------------------------------------------------------------
 * Fixed layout constants of the event-stream wire format and the big-endian
 * primitive readers shared by the codec.
 *
 * <pre>
 *   offset 0   TotalLength     uint32
 *   offset 4   HeadersLength   uint32
 *   offset 8   PreludeCrc      uint32  (CRC32C of bytes 0..7)
 *   offset 12  Headers         headersLength bytes
 *   ...        Payload
 *   end-4      MessageCrc      uint32  (CRC32C of bytes 0..end-5)
 * </pre>
 */
public final class EventStreamFraming
{
    public static final int PRELUDE_SIZE = 12;
    public static final int MESSAGE_CRC_SIZE = 4;
    public static final int MIN_MESSAGE_SIZE = PRELUDE_SIZE + MESSAGE_CRC_SIZE;
    public static final int MAX_MESSAGE_SIZE = EventStreamDecoderConfig.MAX_FRAME_LENGTH;

    /** {@code :content-type} value marking a payload that is itself an event-stream. */
    public static final String NESTED_CONTENT_TYPE = "application/vnd.amazon.eventstream";

    static final int GZIP_MAGIC_0 = 0x1F;
    static final int GZIP_MAGIC_1 = 0x8B;

    private EventStreamFraming() {}

    static long readUInt32(byte[] buf, int offset) {
        return ((long) (buf[offset] & 0xFF) << 24)
                | ((buf[offset + 1] & 0xFF) << 16)
                | ((buf[offset + 2] & 0xFF) << 8)
                |  (buf[offset + 3] & 0xFF);
    }

    static int readUInt16(byte[] buf, int offset) {
        return ((buf[offset] & 0xFF) << 8) | (buf[offset + 1] & 0xFF);
    }

    static long readInt64(byte[] buf, int offset) {
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v = (v << 8) | (buf[offset + i] & 0xFF);
        }
        return v;
    }

    static void writeUInt32(byte[] buf, int offset, long value) {
        buf[offset] = (byte) ((value >>> 24) & 0xFF);
        buf[offset + 1] = (byte) ((value >>> 16) & 0xFF);
        buf[offset + 2] = (byte) ((value >>> 8) & 0xFF);
        buf[offset + 3] = (byte) (value & 0xFF);
    }

    static boolean startsWithGzipMagic(byte[] payload) {
        return payload.length >= 2
                && (payload[0] & 0xFF) == GZIP_MAGIC_0
                && (payload[1] & 0xFF) == GZIP_MAGIC_1;
    }
}
