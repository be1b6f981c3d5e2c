package com.questrail.eventstream.codec.impl;

/**
 * EventStreamCrc32c
 * -----------------------------------------------------------------------------
 * Table-driven CRC32C used by the prelude and message checksum fields.
 *
 * <pre>
 *   Name:            CRC-32C (Castagnoli)
 *   Width:           32
 *   Polynomial:      0x1EDC6F41 (reflected 0x82F63B78)
 *   Initial value:   0xFFFFFFFF
 *   Input/output:    reflected
 *   XOROUT:          0xFFFFFFFF
 *   Check("123456789") = 0xE3069283
 * </pre>
 *
 * <p>The 256-entry table is built on first use and shared for the lifetime
 * of the class loader.</p>
 */
public final class EventStreamCrc32c
{
    private static final int REFLECTED_POLY = 0x82F63B78;

    private EventStreamCrc32c() {}

    /**
     * Computes the checksum of the whole array.
     *
     * @return the checksum as an unsigned 32-bit value
     */
    public static long checksum(byte[] data) {
        return checksum(data, 0, data.length);
    }

    /**
     * Computes the checksum of {@code data[off, off+len)}.
     *
     * @return the checksum as an unsigned 32-bit value
     */
    public static long checksum(byte[] data, int off, int len) {
        final int[] table = Table.ENTRIES;
        int crc = 0xFFFFFFFF;
        for (int i = off; i < off + len; i++) {
            crc = (crc >>> 8) ^ table[(crc ^ data[i]) & 0xFF];
        }
        return (crc ^ 0xFFFFFFFF) & 0xFFFFFFFFL;
    }

    // Holder idiom: the table is built when ENTRIES is first touched.
    private static final class Table {
        static final int[] ENTRIES = build();

        private static int[] build() {
            int[] table = new int[256];
            for (int i = 0; i < 256; i++) {
                int crc = i;
                for (int b = 0; b < 8; b++) {
                    if ((crc & 1) != 0) {
                        crc = (crc >>> 1) ^ REFLECTED_POLY;
                    } else {
                        crc = (crc >>> 1);
                    }
                }
                table[i] = crc;
            }
            return table;
        }
    }
}
