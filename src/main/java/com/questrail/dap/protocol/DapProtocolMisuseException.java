package com.questrail.dap.protocol;

/**
 * Indicates that the local caller tried something the protocol forbids, such as
 * sending the same response twice. The offending frame is never written.
 */
public final class DapProtocolMisuseException extends DapProtocolException
{
    public DapProtocolMisuseException(String message) {
        super(message);
    }
}
