package com.questrail.eventstream.internal.decode;

/**
 * Indicates that the streaming decoder refused input or, in strict mode,
 * hit malformed bytes.
 *
 * This typically reflects:
 * <ul>
 *   <li>A feed that would grow the buffer past its configured maximum</li>
 *   <li>A wire-level format error surfaced by strict mode</li>
 * </ul>
 */
public final class EventStreamDecodeException extends RuntimeException
{
    public EventStreamDecodeException(String message) {
        super(message);
    }

    public EventStreamDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
