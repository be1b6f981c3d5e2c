package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.internal.frame.HeaderType;
import com.questrail.eventstream.internal.frame.HeaderValue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * EventStreamHeaderCodec
 * -----------------------------------------------------------------------------
 * Decodes and encodes the header region of an event-stream frame.
 *
 * <p>The region is a sequence of records, read until it is exhausted:</p>
 * <pre>
 *   NameLength(1) Name(NameLength, UTF-8) TypeTag(1) Value(per tag)
 * </pre>
 *
 * <p>See {@link HeaderType} for the per-tag value layout. A name that repeats
 * within one region keeps its last value.</p>
 *
 * <p>This codec performs no recovery. An unknown tag or a record running past
 * the end of the region is a {@link HeaderFormatException}.</p>
 */
public final class EventStreamHeaderCodec
{
    static final int MAX_NAME_LENGTH = 0xFF;
    static final int MAX_VALUE_LENGTH = 0xFFFF;

    private EventStreamHeaderCodec() {}

    /**
     * Decodes the whole array as a header region.
     */
    public static Map<String, HeaderValue> decode(byte[] region) throws HeaderFormatException {
        return decode(region, 0, region.length);
    }

    /**
     * Decodes {@code buf[offset, offset+length)} as a header region.
     *
     * @return headers in wire order
     * @throws HeaderFormatException on an unknown type tag or truncated record
     */
    public static Map<String, HeaderValue> decode(byte[] buf, int offset, int length)
            throws HeaderFormatException
    {
        final Map<String, HeaderValue> headers = new LinkedHashMap<>();
        final int end = offset + length;
        int pos = offset;

        while (pos < end) {
            final int nameLength = buf[pos] & 0xFF;
            pos += 1;
            require(pos, nameLength + 1, end, "header name");

            final String name = new String(buf, pos, nameLength, StandardCharsets.UTF_8);
            pos += nameLength;

            final int tag = buf[pos] & 0xFF;
            pos += 1;

            final HeaderType type = HeaderType.fromTag(tag);
            if (type == null) {
                throw new HeaderFormatException("Unknown header type " + tag + " for header '" + name + "'");
            }

            final HeaderValue value;
            switch (type) {
                case BOOL_TRUE -> value = new HeaderValue.BoolValue(true);
                case BOOL_FALSE -> value = new HeaderValue.BoolValue(false);
                case BYTE -> {
                    require(pos, 1, end, name);
                    value = new HeaderValue.ByteValue(buf[pos]);
                    pos += 1;
                }
                case SHORT -> {
                    require(pos, 2, end, name);
                    value = new HeaderValue.ShortValue((short) EventStreamFraming.readUInt16(buf, pos));
                    pos += 2;
                }
                case INTEGER -> {
                    require(pos, 4, end, name);
                    value = new HeaderValue.IntValue((int) EventStreamFraming.readUInt32(buf, pos));
                    pos += 4;
                }
                case LONG -> {
                    require(pos, 8, end, name);
                    value = new HeaderValue.LongValue(EventStreamFraming.readInt64(buf, pos));
                    pos += 8;
                }
                case BYTE_ARRAY -> {
                    require(pos, 2, end, name);
                    final int len = EventStreamFraming.readUInt16(buf, pos);
                    pos += 2;
                    require(pos, len, end, name);
                    value = new HeaderValue.BytesValue(Arrays.copyOfRange(buf, pos, pos + len));
                    pos += len;
                }
                case STRING -> {
                    require(pos, 2, end, name);
                    final int len = EventStreamFraming.readUInt16(buf, pos);
                    pos += 2;
                    require(pos, len, end, name);
                    value = new HeaderValue.StringValue(new String(buf, pos, len, StandardCharsets.UTF_8));
                    pos += len;
                }
                case TIMESTAMP -> {
                    require(pos, 8, end, name);
                    value = HeaderValue.TimestampValue.ofEpochMilli(EventStreamFraming.readInt64(buf, pos));
                    pos += 8;
                }
                case UUID -> {
                    require(pos, HeaderValue.UuidValue.LENGTH, end, name);
                    value = new HeaderValue.UuidValue(
                            Arrays.copyOfRange(buf, pos, pos + HeaderValue.UuidValue.LENGTH));
                    pos += HeaderValue.UuidValue.LENGTH;
                }
                default -> throw new IllegalStateException("Unhandled header type " + type);
            }

            headers.put(name, value);
        }

        return headers;
    }

    /**
     * Encodes headers in iteration order.
     *
     * @throws IllegalArgumentException if a name exceeds 255 UTF-8 bytes or a
     *         string/bytes value exceeds 65535 bytes
     */
    public static byte[] encode(Map<String, HeaderValue> headers) {
        Objects.requireNonNull(headers, "headers");
        final ByteArrayOutputStream out = new ByteArrayOutputStream();

        for (Map.Entry<String, HeaderValue> e : headers.entrySet()) {
            final byte[] name = e.getKey().getBytes(StandardCharsets.UTF_8);
            if (name.length > MAX_NAME_LENGTH) {
                throw new IllegalArgumentException("Header name longer than 255 bytes: " + e.getKey());
            }
            final HeaderValue value = Objects.requireNonNull(e.getValue(), e.getKey());

            out.write(name.length);
            out.write(name, 0, name.length);
            out.write(value.type().tag());

            if (value instanceof HeaderValue.ByteValue v) {
                out.write(v.value());
            } else if (value instanceof HeaderValue.ShortValue v) {
                writeBigEndian(out, v.value(), 2);
            } else if (value instanceof HeaderValue.IntValue v) {
                writeBigEndian(out, v.value(), 4);
            } else if (value instanceof HeaderValue.LongValue v) {
                writeBigEndian(out, v.value(), 8);
            } else if (value instanceof HeaderValue.BytesValue v) {
                writeLengthPrefixed(out, v.value(), e.getKey());
            } else if (value instanceof HeaderValue.StringValue v) {
                writeLengthPrefixed(out, v.value().getBytes(StandardCharsets.UTF_8), e.getKey());
            } else if (value instanceof HeaderValue.TimestampValue v) {
                writeBigEndian(out, v.epochMillis(), 8);
            } else if (value instanceof HeaderValue.UuidValue v) {
                out.write(v.value(), 0, HeaderValue.UuidValue.LENGTH);
            }
            // BoolValue carries its value in the tag.
        }

        return out.toByteArray();
    }

    private static void require(int pos, int needed, int end, String what)
            throws HeaderFormatException
    {
        if (needed > end - pos) {
            throw new HeaderFormatException("Truncated header record: " + what);
        }
    }

    private static void writeBigEndian(ByteArrayOutputStream out, long value, int width) {
        for (int shift = (width - 1) * 8; shift >= 0; shift -= 8) {
            out.write((int) ((value >>> shift) & 0xFF));
        }
    }

    private static void writeLengthPrefixed(ByteArrayOutputStream out, byte[] bytes, String name) {
        if (bytes.length > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("Header value longer than 65535 bytes: " + name);
        }
        writeBigEndian(out, bytes.length, 2);
        out.write(bytes, 0, bytes.length);
    }
}
