/**
 * Event-stream Codec: Wire-Level Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for the binary
 * event-stream format: length-prefixed frames, each carrying typed headers
 * and an opaque payload.</p>
 *
 * <h2>Wire format (big-endian)</h2>
 * <pre>
 *   Frame       := Prelude(12) Headers(headersLength) Payload Checksum(4)
 *   Prelude     := TotalLength(4) HeadersLength(4) PreludeChecksum(4)
 *   HeaderEntry := NameLength(1) Name TypeTag(1) Value
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk
 *        → EventStreamDecoder        (buffering, resync)
 *            → EventStreamFrameDecoder   (wire rules applied here)
 *                → EventStreamFrame
 *                    → EventStreamEventMapper
 *                        → EventStreamEvent
 * </pre>
 *
 * <h2>Error model</h2>
 * <p>Wire-level failures are reported as checked
 * {@link com.questrail.eventstream.codec.EventStreamFormatException}s.
 * Deciding what to do about them belongs to the streaming decoder.</p>
 */
package com.questrail.eventstream.codec;
