package com.questrail.dap.protocol.internal.encode;

import com.questrail.dap.protocol.DapProtocolException;

/**
 * Indicates that an outgoing message could not be serialized to JSON.
 * Nothing is written and no sequence number is consumed.
 */
public final class DapEncodeException extends DapProtocolException
{
    public DapEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
