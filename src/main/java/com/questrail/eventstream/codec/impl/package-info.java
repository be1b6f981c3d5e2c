/**
 * Event-stream Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>Concrete codec pieces that bridge buffered bytes and
 * {@link com.questrail.eventstream.internal.frame.EventStreamFrame}s.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] buffer, offset
 *        → EventStreamFraming          (prelude layout, length bounds)
 *        → EventStreamCrc32c           (optional prelude / message checks)
 *        → EventStreamHeaderCodec      (typed headers)
 *        → GzipPayloads                (best-effort payload inflate)
 *        → EventStreamFrame
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>stateless between calls</li>
 *   <li>transport-agnostic</li>
 *   <li>semantics-free (no JSON, no event types)</li>
 * </ul>
 */
package com.questrail.eventstream.codec.impl;
