package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.codec.EventStreamFormatException;
import com.questrail.eventstream.codec.EventStreamFrameDecoder;
import com.questrail.eventstream.config.EventStreamDecoderConfig;
import com.questrail.eventstream.internal.frame.EventStreamFrame;
import com.questrail.eventstream.internal.frame.HeaderValue;
import com.questrail.eventstream.observability.EventStreamErrorEvent;
import com.questrail.eventstream.observability.EventStreamObservabilitySink;
import com.questrail.eventstream.observability.NullObservabilitySink;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.questrail.eventstream.codec.impl.EventStreamFraming.MAX_MESSAGE_SIZE;
import static com.questrail.eventstream.codec.impl.EventStreamFraming.MESSAGE_CRC_SIZE;
import static com.questrail.eventstream.codec.impl.EventStreamFraming.MIN_MESSAGE_SIZE;
import static com.questrail.eventstream.codec.impl.EventStreamFraming.PRELUDE_SIZE;

/**
 * DefaultEventStreamFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link EventStreamFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Prelude: read and bound-check total and headers lengths</li>
 *   <li>Prelude CRC (only when verification is enabled)</li>
 *   <li>Completeness: wait until the declared total length is buffered</li>
 *   <li>Message CRC (only when verification is enabled)</li>
 *   <li>Header region decode</li>
 *   <li>Payload: nested event-stream recursion, otherwise gunzip (best-effort
 *       unless the decoder is strict)</li>
 * </ol>
 *
 * <p>Checksums are read on every frame but only enforced when
 * {@link EventStreamDecoderConfig#verifyChecksums()} is set.</p>
 */
public final class DefaultEventStreamFrameDecoder implements EventStreamFrameDecoder
{
    private final EventStreamDecoderConfig config;
    private final EventStreamObservabilitySink sink;

    public DefaultEventStreamFrameDecoder() {
        this(EventStreamDecoderConfig.defaults(), NullObservabilitySink.INSTANCE);
    }

    public DefaultEventStreamFrameDecoder(EventStreamDecoderConfig config,
                                          EventStreamObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public Optional<EventStreamFrame> extract(byte[] buffer, int offset, int length)
            throws EventStreamFormatException
    {
        Objects.requireNonNull(buffer, "buffer");
        if (offset < 0 || length < 0 || offset + length > buffer.length) {
            throw new IndexOutOfBoundsException(
                    "offset=" + offset + " length=" + length + " buffer=" + buffer.length);
        }
        return extract(buffer, offset, length, 0);
    }

    private Optional<EventStreamFrame> extract(byte[] buffer, int offset, int length, int depth)
            throws EventStreamFormatException
    {
        // 1) Prelude
        if (length < PRELUDE_SIZE) {
            return Optional.empty();
        }

        final long totalLength = EventStreamFraming.readUInt32(buffer, offset);
        final long headersLength = EventStreamFraming.readUInt32(buffer, offset + 4);

        if (totalLength < MIN_MESSAGE_SIZE || totalLength > MAX_MESSAGE_SIZE) {
            throw new FramingException("Invalid message length: " + totalLength);
        }
        if (headersLength > totalLength - MIN_MESSAGE_SIZE) {
            throw new FramingException(
                    "Headers length " + headersLength + " exceeds message length " + totalLength);
        }

        // 2) Prelude CRC only needs the first 12 bytes
        if (config.verifyChecksums()) {
            verify(buffer, offset, 8, EventStreamFraming.readUInt32(buffer, offset + 8), "prelude");
        }

        // 3) Completeness
        final int total = (int) totalLength;
        if (length < total) {
            return Optional.empty();
        }

        // 4) Message CRC covers everything up to the trailing checksum
        final int crcOffset = offset + total - MESSAGE_CRC_SIZE;
        final long messageCrc = EventStreamFraming.readUInt32(buffer, crcOffset);
        if (config.verifyChecksums()) {
            verify(buffer, offset, total - MESSAGE_CRC_SIZE, messageCrc, "message");
        }

        // 5) Headers
        final int headersStart = offset + PRELUDE_SIZE;
        final int headersEnd = headersStart + (int) headersLength;
        final Map<String, HeaderValue> headers =
                EventStreamHeaderCodec.decode(buffer, headersStart, (int) headersLength);

        // 6) Payload
        final int payloadLength = crcOffset - headersEnd;

        HeaderValue contentType = headers.get(EventStreamFrame.CONTENT_TYPE_HEADER);
        if (contentType instanceof HeaderValue.StringValue s
                && EventStreamFraming.NESTED_CONTENT_TYPE.equals(s.value())) {
            // An inner frame that is not complete inside a complete outer frame
            // never will be; the outer frame is yielded without content.
            return Optional.of(extractNested(buffer, headersEnd, payloadLength, depth + 1)
                    .map(inner -> EventStreamFrame.withNested(headers, inner, total))
                    .orElseGet(() -> EventStreamFrame.withPayload(headers, null, total)));
        }

        byte[] payload = Arrays.copyOfRange(buffer, headersEnd, crcOffset);
        if (config.decompressPayloads() && EventStreamFraming.startsWithGzipMagic(payload)) {
            payload = gunzipOrRaw(payload);
        }

        return Optional.of(EventStreamFrame.withPayload(headers, payload, total));
    }

    private Optional<EventStreamFrame> extractNested(byte[] buffer, int offset, int length, int depth)
            throws EventStreamFormatException
    {
        if (depth > config.maxNestingDepth()) {
            throw new FramingException("Nested event-stream depth exceeds " + config.maxNestingDepth());
        }
        return extract(buffer, offset, length, depth);
    }

    private byte[] gunzipOrRaw(byte[] payload) throws FramingException
    {
        try {
            return GzipPayloads.gunzip(payload, config.maxDecompressedSize());
        } catch (IOException e) {
            final String message = "gzip-marked payload of " + payload.length + " bytes could not be decompressed";
            if (config.strict()) {
                throw new FramingException(message, e);
            }
            sink.onPayloadFallback(new EventStreamErrorEvent(Instant.now(), message, e));
            return payload;
        }
    }

    private static void verify(byte[] buffer, int offset, int length, long transmitted, String what)
            throws CrcException
    {
        final long computed = EventStreamCrc32c.checksum(buffer, offset, length);
        if (computed != transmitted) {
            throw new CrcException(String.format(
                    "%s CRC mismatch: transmitted=0x%08X computed=0x%08X",
                    what, transmitted, computed));
        }
    }
}
