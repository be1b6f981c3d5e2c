package com.questrail.eventstream.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Application-level event produced from one decoded frame.
 *
 * @param type value of the frame's {@code :event-type} header; {@code null}
 *             when the frame carries no string {@code :event-type}
 * @param data parsed JSON payload, a text node holding the raw UTF-8 payload
 *             when it is not JSON, or {@code null} for an empty payload
 */
public record EventStreamEvent(String type, JsonNode data) {

    public boolean hasData() {
        return data != null;
    }

    /**
     * True when the payload was kept as plain text or was a JSON string.
     */
    public boolean isText() {
        return data != null && data.isTextual();
    }
}
