package com.questrail.dap.protocol.codec;

/**
 * DapFrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound wire-mechanics boundary: turns one serialized message body into one
 * complete wire frame.
 *
 * <p>The encoder does not decide what to send and never looks inside the body.
 * It only applies framing. The returned array holds the header immediately
 * followed by the body so that the transport can write it as a single unit;
 * two frames written concurrently must never interleave.</p>
 */
public interface DapFrameEncoder
{
    /**
     * Frame a message body.
     *
     * @param body serialized message text
     * @return header and body bytes, ready for immediate transmission
     */
    byte[] encode(String body);
}
