package com.questrail.eventstream.transport;

/**
 * ByteChunkListener
 * -----------------------------------------------------------------------------
 * Callback sink for a transport that delivers an event-stream body in chunks.
 *
 * <p>All callbacks for one stream must be delivered serially. Chunk
 * boundaries carry no meaning; a frame may span any number of chunks.</p>
 */
public interface ByteChunkListener
{
    /**
     * Called when bytes arrive.
     *
     * @param chunk raw bytes, owned by the listener after the call
     */
    void onChunk(byte[] chunk);

    /**
     * Called once when the stream ends.
     *
     * @param cause failure that ended the stream; {@code null} for an orderly end
     */
    void onStreamEnd(Throwable cause);
}
