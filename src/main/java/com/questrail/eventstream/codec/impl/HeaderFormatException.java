package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.codec.EventStreamFormatException;

/**
 * Raised when a header record carries an unknown type tag or is truncated.
 */
public final class HeaderFormatException extends EventStreamFormatException
{
    public HeaderFormatException(String message) {
        super(message);
    }
}
