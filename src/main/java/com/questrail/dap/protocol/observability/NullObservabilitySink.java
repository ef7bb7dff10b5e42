package com.questrail.dap.protocol.observability;

/**
 * No-op implementation of DapObservabilitySink.
 */
public final class NullObservabilitySink implements DapObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(DapTransportEvent event) {}

    @Override
    public void onDiagnostic(DapDiagnosticEvent event) {}

    @Override
    public void onError(DapErrorEvent event) {}
}
