package com.questrail.dap.protocol.observability;

/**
 * Main interface for receiving DAP transport observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface DapObservabilitySink {
    /**
     * Called when the underlying byte stream comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(DapTransportEvent event);

    /**
     * Called for conditions that are recovered locally and are not errors,
     * such as a discarded header or an unmatched response.
     * @param event the diagnostic event
     */
    void onDiagnostic(DapDiagnosticEvent event);

    /**
     * Called when an error is surfaced by the transport.
     * @param event the error event
     */
    void onError(DapErrorEvent event);
}
