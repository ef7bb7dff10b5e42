package com.questrail.dap.protocol.observability;

import java.time.Instant;

/**
 * Record representing an error surfaced by the DAP transport.
 */
public record DapErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
