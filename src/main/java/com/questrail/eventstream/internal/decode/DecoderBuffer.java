package com.questrail.eventstream.internal.decode;

import java.util.Objects;

/**
 * DecoderBuffer
 * -----------------------------------------------------------------------------
 * Growable byte container with explicit front truncation.
 *
 * <p>Readable bytes live in {@code data[start, end)}. Appends go to the back;
 * {@link #skip(int)} advances the front. Space freed at the front is
 * reclaimed lazily by compacting on the next append that needs room.</p>
 *
 * <p>Not thread-safe. Owned by exactly one {@link EventStreamDecoder}.</p>
 */
final class DecoderBuffer
{
    private static final int INITIAL_CAPACITY = 8192;
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private byte[] data = new byte[0];
    private int start;
    private int end;

    /**
     * Number of readable bytes.
     */
    int readable() {
        return end - start;
    }

    /**
     * Backing array. Valid bytes are {@code [readerOffset(), readerOffset() + readable())}.
     * The reference is only stable until the next {@link #append}.
     */
    byte[] array() {
        return data;
    }

    int readerOffset() {
        return start;
    }

    void append(byte[] src, int off, int len) {
        Objects.checkFromIndexSize(off, len, src.length);
        if (len == 0) {
            return;
        }
        ensureWritable(len);
        System.arraycopy(src, off, data, end, len);
        end += len;
    }

    void skip(int n) {
        if (n < 0 || n > readable()) {
            throw new IllegalArgumentException("Cannot skip " + n + " of " + readable() + " bytes");
        }
        start += n;
        if (start == end) {
            start = 0;
            end = 0;
        }
    }

    void clear() {
        data = new byte[0];
        start = 0;
        end = 0;
    }

    private void ensureWritable(int len) {
        if (data.length - end >= len) {
            return;
        }

        final int readable = readable();
        final long needed = (long) readable + len;
        if (needed > MAX_CAPACITY) {
            throw new IllegalStateException("Buffer cannot grow to " + needed + " bytes");
        }
        final int required = (int) needed;

        if (data.length >= required) {
            // Enough room once the consumed prefix is dropped.
            System.arraycopy(data, start, data, 0, readable);
        } else {
            int capacity = Math.max(INITIAL_CAPACITY, data.length);
            while (capacity < required) {
                capacity = (capacity > MAX_CAPACITY / 2) ? MAX_CAPACITY : capacity * 2;
            }
            byte[] grown = new byte[capacity];
            System.arraycopy(data, start, grown, 0, readable);
            data = grown;
        }
        start = 0;
        end = readable;
    }
}
