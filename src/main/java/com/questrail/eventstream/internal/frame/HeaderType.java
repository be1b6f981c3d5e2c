package com.questrail.eventstream.internal.frame;

/**
 * HeaderType
 * -----------------------------------------------------------------------------
 * Wire type tags for event-stream header values.
 *
 * <p>Each tag identifies exactly one value encoding. Tags outside 0-9 are not
 * legal on the wire and are rejected by the header codec.</p>
 *
 * <pre>
 *   tag  encoding                         decoded as
 *   0    (none)                           true
 *   1    (none)                           false
 *   2    1 byte                           signed 8-bit
 *   3    2 bytes BE                       signed 16-bit
 *   4    4 bytes BE                       signed 32-bit
 *   5    8 bytes BE                       signed 64-bit
 *   6    2-byte BE length + N bytes       raw bytes
 *   7    2-byte BE length + N bytes       UTF-8 string
 *   8    8 bytes BE                       epoch milliseconds
 *   9    16 bytes                         UUID
 * </pre>
 */
public enum HeaderType
{
    BOOL_TRUE(0),
    BOOL_FALSE(1),
    BYTE(2),
    SHORT(3),
    INTEGER(4),
    LONG(5),
    BYTE_ARRAY(6),
    STRING(7),
    TIMESTAMP(8),
    UUID(9);

    private static final HeaderType[] BY_TAG = new HeaderType[10];

    static {
        for (HeaderType type : values()) {
            BY_TAG[type.tag] = type;
        }
    }

    private final int tag;

    HeaderType(int tag) {
        this.tag = tag;
    }

    /**
     * Returns the wire tag of this type.
     */
    public int tag() {
        return tag;
    }

    /**
     * Resolves a wire tag.
     *
     * @param tag unsigned tag byte as read from the wire
     * @return the matching type, or {@code null} if the tag is not legal
     */
    public static HeaderType fromTag(int tag) {
        if (tag < 0 || tag >= BY_TAG.length) {
            return null;
        }
        return BY_TAG[tag];
    }
}
