package com.questrail.eventstream.codec;

/**
 * Base type for wire-level format errors raised by the event-stream codec.
 *
 * <p>A format error means the bytes at the current position cannot be a
 * valid frame. It is never fatal: the streaming decoder reacts by skipping a
 * single byte and retrying.</p>
 */
public abstract class EventStreamFormatException extends Exception
{
    protected EventStreamFormatException(String message) {
        super(message);
    }

    protected EventStreamFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
