package com.questrail.dap.protocol.internal.decode;

import com.questrail.dap.protocol.DapProtocolException;

/**
 * Indicates that a correctly framed body could not be parsed as a JSON message.
 *
 * <p>Raised per message. The frame has already been consumed, so the decoder
 * state is unaffected and later frames are processed normally.</p>
 */
public final class DapDecodeException extends DapProtocolException
{
    public DapDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
