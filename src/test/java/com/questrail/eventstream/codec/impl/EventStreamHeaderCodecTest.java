package com.questrail.eventstream.codec.impl;

import com.questrail.eventstream.internal.frame.HeaderValue;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class EventStreamHeaderCodecTest
{
    // ---------------------------------------------------------------------
    // One record per wire tag
    // ---------------------------------------------------------------------

    @Test
    void tag0DecodesToTrue() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.BoolValue(true), single(record("b", 0)));
    }

    @Test
    void tag1DecodesToFalse() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.BoolValue(false), single(record("b", 1)));
    }

    @Test
    void tag2DecodesSignedByte() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.ByteValue((byte) -1), single(record("v", 2, 0xFF)));
    }

    @Test
    void tag3DecodesSignedShortBigEndian() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.ShortValue((short) -2), single(record("v", 3, 0xFF, 0xFE)));
        assertEquals(new HeaderValue.ShortValue((short) 0x0102), single(record("v", 3, 0x01, 0x02)));
    }

    @Test
    void tag4DecodesSignedIntBigEndian() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.IntValue(Integer.MIN_VALUE), single(record("v", 4, 0x80, 0, 0, 0)));
        assertEquals(new HeaderValue.IntValue(258), single(record("v", 4, 0, 0, 0x01, 0x02)));
    }

    @Test
    void tag5DecodesSignedLongBigEndian() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.LongValue(42L), single(record("v", 5, 0, 0, 0, 0, 0, 0, 0, 0x2A)));
        assertEquals(new HeaderValue.LongValue(-1L),
                single(record("v", 5, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF)));
    }

    @Test
    void tag6DecodesLengthPrefixedBytes() throws HeaderFormatException
    {
        HeaderValue value = single(record("v", 6, 0x00, 0x03, 0x01, 0x02, 0x03));
        assertInstanceOf(HeaderValue.BytesValue.class, value);
        assertArrayEquals(new byte[] { 1, 2, 3 }, ((HeaderValue.BytesValue) value).value());
    }

    @Test
    void tag7DecodesLengthPrefixedUtf8() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.StringValue("hello"),
                single(record("v", 7, 0x00, 0x05, 'h', 'e', 'l', 'l', 'o')));
    }

    @Test
    void tag7DecodesMultiByteUtf8() throws HeaderFormatException
    {
        byte[] utf8 = "héllo".getBytes(StandardCharsets.UTF_8);
        int[] value = new int[2 + utf8.length];
        value[1] = utf8.length;
        for (int i = 0; i < utf8.length; i++) {
            value[2 + i] = utf8[i] & 0xFF;
        }
        assertEquals(new HeaderValue.StringValue("héllo"), single(record("v", 7, value)));
    }

    @Test
    void tag8DecodesEpochMillis() throws HeaderFormatException
    {
        assertEquals(new HeaderValue.TimestampValue(Instant.ofEpochMilli(1000)),
                single(record("t", 8, 0, 0, 0, 0, 0, 0, 0x03, 0xE8)));
    }

    @Test
    void tag9DecodesSixteenByteUuid() throws HeaderFormatException
    {
        int[] raw = new int[16];
        for (int i = 0; i < 16; i++) {
            raw[i] = i;
        }
        HeaderValue value = single(record("id", 9, raw));

        assertInstanceOf(HeaderValue.UuidValue.class, value);
        assertEquals("000102030405060708090a0b0c0d0e0f", ((HeaderValue.UuidValue) value).hex());
    }

    // ---------------------------------------------------------------------
    // Region handling
    // ---------------------------------------------------------------------

    @Test
    void emptyRegionDecodesToNoHeaders() throws HeaderFormatException
    {
        assertTrue(EventStreamHeaderCodec.decode(new byte[0]).isEmpty());
    }

    @Test
    void multipleRecordsKeepWireOrder() throws HeaderFormatException
    {
        byte[] region = concat(
                record(":message-type", 7, 0, 5, 'e', 'v', 'e', 'n', 't'),
                record(":event-type", 7, 0, 3, 'e', 'n', 'd'),
                record("flag", 0));

        Map<String, HeaderValue> headers = EventStreamHeaderCodec.decode(region);

        assertEquals(List.of(":message-type", ":event-type", "flag"), List.copyOf(headers.keySet()));
        assertEquals(new HeaderValue.StringValue("end"), headers.get(":event-type"));
    }

    @Test
    void repeatedNameKeepsLastValue() throws HeaderFormatException
    {
        byte[] region = concat(record("x", 0), record("x", 4, 0, 0, 0, 7));

        Map<String, HeaderValue> headers = EventStreamHeaderCodec.decode(region);

        assertEquals(1, headers.size());
        assertEquals(new HeaderValue.IntValue(7), headers.get("x"));
    }

    @Test
    void decodesOnlyTheRequestedRange() throws HeaderFormatException
    {
        byte[] rec = record("b", 0);
        byte[] padded = concat(new byte[] { (byte) 0xAA }, rec, new byte[] { (byte) 0xBB });

        Map<String, HeaderValue> headers = EventStreamHeaderCodec.decode(padded, 1, rec.length);
        assertEquals(Map.of("b", new HeaderValue.BoolValue(true)), headers);
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void unknownTagIsRejected()
    {
        HeaderFormatException e = assertThrows(HeaderFormatException.class,
                () -> EventStreamHeaderCodec.decode(record("x", 10)));
        assertTrue(e.getMessage().contains("10"));
    }

    @Test
    void truncatedValueIsRejected()
    {
        assertThrows(HeaderFormatException.class,
                () -> EventStreamHeaderCodec.decode(record("x", 4, 0, 0)));
    }

    @Test
    void lengthPrefixPastRegionEndIsRejected()
    {
        assertThrows(HeaderFormatException.class,
                () -> EventStreamHeaderCodec.decode(record("x", 7, 0, 9, 'a')));
    }

    @Test
    void truncatedNameIsRejected()
    {
        assertThrows(HeaderFormatException.class,
                () -> EventStreamHeaderCodec.decode(new byte[] { 0x05, 'a', 'b' }));
    }

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    @Test
    void encodeWritesWireLayout()
    {
        Map<String, HeaderValue> headers = new LinkedHashMap<>();
        headers.put("v", new HeaderValue.LongValue(42L));
        headers.put("s", new HeaderValue.StringValue("hello"));

        byte[] expected = concat(
                record("v", 5, 0, 0, 0, 0, 0, 0, 0, 0x2A),
                record("s", 7, 0x00, 0x05, 'h', 'e', 'l', 'l', 'o'));

        assertArrayEquals(expected, EventStreamHeaderCodec.encode(headers));
    }

    @Test
    void encodedHeadersOfEveryTypeDecodeToEqualValues() throws HeaderFormatException
    {
        Map<String, HeaderValue> headers = new LinkedHashMap<>();
        headers.put("t", new HeaderValue.BoolValue(true));
        headers.put("f", new HeaderValue.BoolValue(false));
        headers.put("b", new HeaderValue.ByteValue((byte) -7));
        headers.put("sh", new HeaderValue.ShortValue((short) -300));
        headers.put("i", new HeaderValue.IntValue(123456));
        headers.put("l", new HeaderValue.LongValue(Long.MIN_VALUE));
        headers.put("bytes", new HeaderValue.BytesValue(new byte[] { 9, 8, 7 }));
        headers.put("str", new HeaderValue.StringValue("événement"));
        headers.put("ts", HeaderValue.TimestampValue.ofEpochMilli(1_700_000_000_123L));
        headers.put("id", HeaderValue.UuidValue.of(UUID.fromString("123e4567-e89b-12d3-a456-426614174000")));

        assertEquals(headers, EventStreamHeaderCodec.decode(EventStreamHeaderCodec.encode(headers)));
    }

    @Test
    void encodeRejectsOverlongName()
    {
        Map<String, HeaderValue> headers = Map.of("n".repeat(256), new HeaderValue.BoolValue(true));
        assertThrows(IllegalArgumentException.class, () -> EventStreamHeaderCodec.encode(headers));
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static HeaderValue single(byte[] region) throws HeaderFormatException
    {
        Map<String, HeaderValue> headers = EventStreamHeaderCodec.decode(region);
        assertEquals(1, headers.size());
        return headers.values().iterator().next();
    }

    private static byte[] record(String name, int tag, int... value)
    {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(nameBytes.length);
        out.write(nameBytes, 0, nameBytes.length);
        out.write(tag);
        for (int b : value) {
            out.write(b);
        }
        return out.toByteArray();
    }

    private static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            out.write(p, 0, p.length);
        }
        return out.toByteArray();
    }
}
