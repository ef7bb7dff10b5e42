package com.questrail.dap.protocol.transport;

/**
 * ByteStreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link ByteStreamEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation, in stream order. Netty endpoints deliver on the channel's
 * event loop; stream endpoints deliver on their reader thread.</p>
 */
public interface ByteStreamEndpointListener
{
    /**
     * Called when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the transport becomes unusable.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown or end of stream
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with each chunk of bytes as it arrives.
     *
     * <p>Chunk boundaries carry no meaning: a chunk may hold part of a frame,
     * exactly one frame, or several frames. The listener owns the array.</p>
     *
     * @param chunk bytes received, never empty
     */
    void onBytes(byte[] chunk);
}
