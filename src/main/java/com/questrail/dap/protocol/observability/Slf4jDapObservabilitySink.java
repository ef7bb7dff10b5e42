package com.questrail.dap.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DapObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jDapObservabilitySink implements DapObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDapObservabilitySink.class);

    @Override
    public void onTransportEvent(DapTransportEvent event) {
        if (event.cause() != null) {
            log.info("DAP Transport {}: {}", event.state(), event.cause().toString());
        } else {
            log.info("DAP Transport {}", event.state());
        }
    }

    @Override
    public void onDiagnostic(DapDiagnosticEvent event) {
        if (event.kind() == DapDiagnosticEvent.Kind.PENDING_DROPPED) {
            log.warn("DAP {}: {}", event.kind(), event.detail());
        } else {
            log.debug("DAP {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onError(DapErrorEvent event) {
        log.error("DAP Error: {}", event.message(), event.cause());
    }
}
