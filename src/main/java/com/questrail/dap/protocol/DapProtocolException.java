package com.questrail.dap.protocol;

/**
 * Root of every failure reported by the DAP transport.
 *
 * <p>None of these failures is fatal to the transport itself. They are
 * surfaced on {@link DebugAdapterProtocol#errors()}, to the configured
 * observability sink, or to the caller, and the connection keeps working.</p>
 */
public class DapProtocolException extends RuntimeException
{
    public DapProtocolException(String message) {
        super(message);
    }

    public DapProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
