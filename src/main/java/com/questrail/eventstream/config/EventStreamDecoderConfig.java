package com.questrail.eventstream.config;

/**
 * EventStreamDecoderConfig
 * -----------------------------------------------------------------------------
 * Operational configuration for the event-stream decoder.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>maxBufferSize</b>: Upper bound on bytes held by one streaming
 *       decoder. A feed that would exceed it is rejected. Default 64 MiB
 *       (four maximum-size frames), at most {@code Integer.MAX_VALUE - 8}.</li>
 *   <li><b>maxNestingDepth</b>: Maximum number of nested event-stream
 *       levels unwrapped below a top-level frame. Default 8.</li>
 *   <li><b>maxDecompressedSize</b>: Upper bound on the size of a gunzipped
 *       payload. Larger outputs keep the raw bytes (or fail in strict mode).
 *       Default 64 MiB.</li>
 *   <li><b>verifyChecksums</b>: Validate prelude and message CRC32C fields.
 *       Default off; a mismatch is a format error and follows the normal
 *       resync policy.</li>
 *   <li><b>strict</b>: Surface format errors from {@code decode()} instead
 *       of silently resynchronizing, and treat a gzip-marked payload that
 *       cannot be decompressed as a format error. Default off.</li>
 *   <li><b>decompressPayloads</b>: Gunzip payloads that start with the gzip
 *       magic bytes. Default on.</li>
 * </ul>
 */
public record EventStreamDecoderConfig(
        int maxBufferSize,
        int maxNestingDepth,
        int maxDecompressedSize,
        boolean verifyChecksums,
        boolean strict,
        boolean decompressPayloads
) {
    public static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;
    public static final int DEFAULT_MAX_BUFFER_SIZE = 4 * MAX_FRAME_LENGTH;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 8;

    /**
     * Largest byte array the JVM reliably allocates.
     */
    public static final int MAX_BUFFER_SIZE_LIMIT = Integer.MAX_VALUE - 8;

    public EventStreamDecoderConfig {
        if (maxBufferSize < MAX_FRAME_LENGTH) {
            throw new IllegalArgumentException(
                    "maxBufferSize must hold at least one maximum-size frame (" + MAX_FRAME_LENGTH + " bytes)");
        }
        if (maxBufferSize > MAX_BUFFER_SIZE_LIMIT) {
            throw new IllegalArgumentException("maxBufferSize must not exceed " + MAX_BUFFER_SIZE_LIMIT);
        }
        if (maxNestingDepth < 0) {
            throw new IllegalArgumentException("maxNestingDepth must be non-negative");
        }
        if (maxDecompressedSize <= 0) {
            throw new IllegalArgumentException("maxDecompressedSize must be positive");
        }
    }

    /**
     * Lenient defaults: no checksum verification, resync on error, gzip on.
     */
    public static EventStreamDecoderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxBufferSize = DEFAULT_MAX_BUFFER_SIZE;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private int maxDecompressedSize = DEFAULT_MAX_BUFFER_SIZE;
        private boolean verifyChecksums = false;
        private boolean strict = false;
        private boolean decompressPayloads = true;

        public Builder withMaxBufferSize(int maxBufferSize) {
            this.maxBufferSize = maxBufferSize;
            return this;
        }

        public Builder withMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder withMaxDecompressedSize(int maxDecompressedSize) {
            this.maxDecompressedSize = maxDecompressedSize;
            return this;
        }

        public Builder withVerifyChecksums(boolean verifyChecksums) {
            this.verifyChecksums = verifyChecksums;
            return this;
        }

        public Builder withStrict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder withDecompressPayloads(boolean decompressPayloads) {
            this.decompressPayloads = decompressPayloads;
            return this;
        }

        public EventStreamDecoderConfig build() {
            return new EventStreamDecoderConfig(
                    maxBufferSize,
                    maxNestingDepth,
                    maxDecompressedSize,
                    verifyChecksums,
                    strict,
                    decompressPayloads);
        }
    }
}
