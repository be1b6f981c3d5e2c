package com.questrail.eventstream.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.eventstream.api.EventStreamEvent;
import com.questrail.eventstream.internal.frame.EventStreamFrame;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * EventStreamEventMapper
 * ============================================================================
 * Converts a decoded {@link EventStreamFrame} into an {@link EventStreamEvent}.
 *
 * <ul>
 *   <li>{@code type} is the {@code :event-type} string header</li>
 *   <li>an empty payload maps to {@code data == null}</li>
 *   <li>a payload that parses as a single JSON value maps to that tree</li>
 *   <li>anything else maps to a text node of the UTF-8 payload</li>
 * </ul>
 *
 * Every frame produces an event; this mapper never throws on payload content.
 */
public final class EventStreamEventMapper
{
    private final ObjectReader reader;

    public EventStreamEventMapper() {
        this(new ObjectMapper());
    }

    /**
     * @param mapper mapper used to parse payloads; trailing content after the
     *               first JSON value is always rejected
     */
    public EventStreamEventMapper(ObjectMapper mapper) {
        Objects.requireNonNull(mapper, "mapper");
        this.reader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public EventStreamEvent toEvent(EventStreamFrame frame) {
        Objects.requireNonNull(frame, "frame");

        final String type = frame.stringHeader(EventStreamFrame.EVENT_TYPE_HEADER).orElse(null);

        if (frame.payloadLength() == 0) {
            return new EventStreamEvent(type, null);
        }

        final String text = new String(frame.payload(), StandardCharsets.UTF_8);
        return new EventStreamEvent(type, parseOrText(text));
    }

    public List<EventStreamEvent> toEvents(List<EventStreamFrame> frames) {
        Objects.requireNonNull(frames, "frames");
        List<EventStreamEvent> events = new ArrayList<>(frames.size());
        for (EventStreamFrame frame : frames) {
            events.add(toEvent(frame));
        }
        return events;
    }

    private JsonNode parseOrText(String text) {
        try {
            JsonNode node = reader.readTree(text);
            // Blank input reads as a missing node rather than failing.
            if (node == null || node.isMissingNode()) {
                return TextNode.valueOf(text);
            }
            return node;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }
}
