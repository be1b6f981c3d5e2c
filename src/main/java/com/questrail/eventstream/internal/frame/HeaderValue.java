package com.questrail.eventstream.internal.frame;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * HeaderValue
 * -----------------------------------------------------------------------------
 * Typed value of a single event-stream header.
 *
 * <p>This is a closed set: every legal wire tag maps to exactly one variant,
 * and no other variants exist. Consumers may rely on exhaustive handling.</p>
 *
 * <p>Array-backed variants ({@link BytesValue}, {@link UuidValue}) copy on the
 * way in and on the way out, so values remain immutable.</p>
 */
public sealed interface HeaderValue
        permits HeaderValue.BoolValue,
                HeaderValue.ByteValue,
                HeaderValue.ShortValue,
                HeaderValue.IntValue,
                HeaderValue.LongValue,
                HeaderValue.BytesValue,
                HeaderValue.StringValue,
                HeaderValue.TimestampValue,
                HeaderValue.UuidValue
{
    /**
     * Returns the wire type this value is encoded as.
     */
    HeaderType type();

    /** Tags 0 and 1. */
    record BoolValue(boolean value) implements HeaderValue {
        @Override
        public HeaderType type() {
            return value ? HeaderType.BOOL_TRUE : HeaderType.BOOL_FALSE;
        }
    }

    /** Tag 2. */
    record ByteValue(byte value) implements HeaderValue {
        @Override
        public HeaderType type() {
            return HeaderType.BYTE;
        }
    }

    /** Tag 3. */
    record ShortValue(short value) implements HeaderValue {
        @Override
        public HeaderType type() {
            return HeaderType.SHORT;
        }
    }

    /** Tag 4. */
    record IntValue(int value) implements HeaderValue {
        @Override
        public HeaderType type() {
            return HeaderType.INTEGER;
        }
    }

    /** Tag 5. */
    record LongValue(long value) implements HeaderValue {
        @Override
        public HeaderType type() {
            return HeaderType.LONG;
        }
    }

    /** Tag 6. */
    final class BytesValue implements HeaderValue {
        private final byte[] value;

        public BytesValue(byte[] value) {
            this.value = Objects.requireNonNull(value, "value").clone();
        }

        public byte[] value() {
            return value.clone();
        }

        public int length() {
            return value.length;
        }

        @Override
        public HeaderType type() {
            return HeaderType.BYTE_ARRAY;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[length=" + value.length + ']';
        }
    }

    /** Tag 7. */
    record StringValue(String value) implements HeaderValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public HeaderType type() {
            return HeaderType.STRING;
        }
    }

    /** Tag 8. Millisecond precision on the wire. */
    record TimestampValue(Instant value) implements HeaderValue {
        public TimestampValue {
            Objects.requireNonNull(value, "value");
        }

        public static TimestampValue ofEpochMilli(long epochMillis) {
            return new TimestampValue(Instant.ofEpochMilli(epochMillis));
        }

        public long epochMillis() {
            return value.toEpochMilli();
        }

        @Override
        public HeaderType type() {
            return HeaderType.TIMESTAMP;
        }
    }

    /** Tag 9. Exactly 16 raw bytes. */
    final class UuidValue implements HeaderValue {
        public static final int LENGTH = 16;

        private final byte[] value;

        public UuidValue(byte[] value) {
            Objects.requireNonNull(value, "value");
            if (value.length != LENGTH) {
                throw new IllegalArgumentException("UUID header value must be 16 bytes, got " + value.length);
            }
            this.value = value.clone();
        }

        public static UuidValue of(java.util.UUID uuid) {
            ByteBuffer buf = ByteBuffer.allocate(LENGTH);
            buf.putLong(uuid.getMostSignificantBits());
            buf.putLong(uuid.getLeastSignificantBits());
            return new UuidValue(buf.array());
        }

        public byte[] value() {
            return value.clone();
        }

        /**
         * Returns the lowercase hex rendering (32 characters, no dashes).
         */
        public String hex() {
            return HexFormat.of().formatHex(value);
        }

        public java.util.UUID toUuid() {
            ByteBuffer buf = ByteBuffer.wrap(value);
            return new java.util.UUID(buf.getLong(), buf.getLong());
        }

        @Override
        public HeaderType type() {
            return HeaderType.UUID;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof UuidValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "UuidValue[" + hex() + ']';
        }
    }
}
