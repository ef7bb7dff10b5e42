package com.questrail.dap.protocol.codec;

/**
 * DapFrameDecoder
 * -----------------------------------------------------------------------------
 * Inbound wire-mechanics boundary: reassembles message bodies from arbitrarily
 * chunked stream input.
 *
 * <p>Unlike a datagram decoder, an instance is <strong>stateful</strong>. Bytes
 * that do not yet form a complete frame are retained between calls, so one
 * instance belongs to exactly one connection and must only be fed from that
 * connection's serial processing context.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Locating and parsing frame headers</li>
 *   <li>Waiting for partial headers and bodies to complete</li>
 *   <li>Discarding header blocks it cannot interpret</li>
 *   <li>Handing complete bodies to a {@link DapFrameListener}, in arrival order</li>
 * </ul>
 *
 * <p>It never parses the body itself.</p>
 */
public interface DapFrameDecoder
{
    /**
     * Append {@code length} bytes of {@code chunk} starting at {@code offset} and
     * emit every frame that is now complete.
     *
     * <p>The call returns as soon as the buffered bytes no longer contain a
     * complete header or body; it never blocks waiting for input.</p>
     */
    void decode(byte[] chunk, int offset, int length, DapFrameListener listener);

    /**
     * Append the whole of {@code chunk} and emit every frame that is now complete.
     */
    default void decode(byte[] chunk, DapFrameListener listener)
    {
        decode(chunk, 0, chunk.length, listener);
    }

    /**
     * Number of received bytes not yet consumed by a complete header or body.
     */
    int bufferedBytes();
}
