package com.questrail.eventstream.internal.frame;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class EventStreamFrameTest
{
    @Test
    void payloadIsDefensivelyCopied()
    {
        byte[] payload = new byte[] { 1, 2 };
        EventStreamFrame frame = EventStreamFrame.withPayload(Map.of(), payload, 18);

        payload[0] = 9;
        frame.payload()[1] = 9;

        assertArrayEquals(new byte[] { 1, 2 }, frame.payload());
    }

    @Test
    void nestedFrameHasEmptyPayload()
    {
        EventStreamFrame inner = EventStreamFrame.withPayload(Map.of(), new byte[] { 1 }, 17);
        EventStreamFrame outer = EventStreamFrame.withNested(Map.of(), inner, 60);

        assertTrue(outer.isNested());
        assertEquals(0, outer.payloadLength());
        assertSame(inner, outer.nested().orElseThrow());
    }

    @Test
    void headersAreUnmodifiable()
    {
        Map<String, HeaderValue> headers = new LinkedHashMap<>();
        headers.put("a", new HeaderValue.BoolValue(true));
        EventStreamFrame frame = EventStreamFrame.withPayload(headers, new byte[0], 16);

        headers.put("b", new HeaderValue.BoolValue(false));

        assertEquals(1, frame.headers().size());
        assertThrows(UnsupportedOperationException.class,
                () -> frame.headers().put("c", new HeaderValue.BoolValue(true)));
    }

    @Test
    void stringHeaderIgnoresOtherTypes()
    {
        Map<String, HeaderValue> headers = new LinkedHashMap<>();
        headers.put("s", new HeaderValue.StringValue("v"));
        headers.put("i", new HeaderValue.IntValue(1));
        EventStreamFrame frame = EventStreamFrame.withPayload(headers, new byte[0], 16);

        assertEquals(Optional.of("v"), frame.stringHeader("s"));
        assertEquals(Optional.empty(), frame.stringHeader("i"));
        assertEquals(Optional.of(new HeaderValue.IntValue(1)), frame.header("i"));
    }
}
