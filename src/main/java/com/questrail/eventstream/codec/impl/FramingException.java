package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.codec.EventStreamFormatException;

/**
 * Raised when a frame's prelude declares an illegal length, its regions do not
 * fit inside the declared total length, nesting is too deep, or (in strict
 * mode) a gzip-marked payload cannot be decompressed.
 */
public final class FramingException extends EventStreamFormatException
{
    public FramingException(String message) {
        super(message);
    }

    public FramingException(String message, Throwable cause) {
        super(message, cause);
    }
}
