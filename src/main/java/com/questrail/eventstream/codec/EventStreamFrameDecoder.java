package com.questrail.eventstream.codec;

import com.questrail.eventstream.internal.frame.EventStreamFrame;

import java.util.Optional;

/**
 * EventStreamFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for exactly one event-stream frame.
 *
 * <p>This interface defines the boundary between buffered wire bytes and a
 * structured {@link EventStreamFrame}.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Validating the prelude lengths before trusting them</li>
 *   <li>Detecting that a frame is not yet complete</li>
 *   <li>Decoding headers and payload (including nested streams and gzip)</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Buffering or accumulation across calls</li>
 *   <li>Recovering from malformed input</li>
 *   <li>Mapping frames to application events</li>
 * </ul>
 */
public interface EventStreamFrameDecoder
{
    /**
     * Attempt to extract one frame starting at {@code offset}.
     *
     * <p>No state is kept between calls and the input array is never
     * modified.</p>
     *
     * @param buffer backing bytes
     * @param offset index of the first byte of the candidate frame
     * @param length number of valid bytes available from {@code offset}
     * @return the decoded frame, or {@link Optional#empty()} if fewer bytes are
     *         available than the frame declares
     * @throws EventStreamFormatException if the bytes at {@code offset} cannot
     *         form a valid frame
     */
    Optional<EventStreamFrame> extract(byte[] buffer, int offset, int length)
            throws EventStreamFormatException;
}
