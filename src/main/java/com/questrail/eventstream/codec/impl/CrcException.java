package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.codec.EventStreamFormatException;

/**
 * Raised when checksum verification is enabled and a prelude or message
 * CRC32C does not match the transmitted value.
 */
public final class CrcException extends EventStreamFormatException
{
    public CrcException(String message) {
        super(message);
    }
}
