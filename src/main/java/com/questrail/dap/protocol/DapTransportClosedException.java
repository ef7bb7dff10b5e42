package com.questrail.dap.protocol;

/**
 * Raised for sends attempted after {@link DebugAdapterProtocol#close()}, and
 * handed to the handlers of requests still pending at teardown.
 */
public final class DapTransportClosedException extends DapProtocolException
{
    public DapTransportClosedException(String message) {
        super(message);
    }
}
