package com.questrail.eventstream.codec.impl;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GzipPayloads
 * -----------------------------------------------------------------------------
 * Gzip helpers for frame payloads.
 */
public final class GzipPayloads
{
    private static final int CHUNK = 8192;

    private GzipPayloads() {}

    /**
     * Decompresses a gzip member.
     *
     * @param compressed gzip bytes
     * @param maxSize    upper bound on the decompressed size
     * @throws IOException if the input is not valid gzip or inflates past {@code maxSize}
     */
    public static byte[] gunzip(byte[] compressed, int maxSize) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed));
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] chunk = new byte[CHUNK];
            int total = 0;
            int n;
            while ((n = in.read(chunk)) != -1) {
                total += n;
                if (total > maxSize) {
                    throw new IOException("Decompressed payload exceeds " + maxSize + " bytes");
                }
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        }
    }

    /**
     * Compresses bytes as a single gzip member.
     */
    public static byte[] gzip(byte[] plain) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(plain);
        } catch (IOException e) {
            throw new UncheckedIOException("In-memory gzip failed", e);
        }
        return out.toByteArray();
    }
}
