package com.questrail.dap.protocol.config;

/**
 * What happens to requests still awaiting a response when the transport is
 * closed.
 */
public enum PendingRequestPolicy {
    /** Invoke each handler's {@code onFailure} once. */
    FAIL,
    /** Discard the handlers without invoking them; the count is reported as a diagnostic. */
    DROP
}
