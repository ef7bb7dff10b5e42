package com.questrail.dap.protocol.observability;

import java.time.Instant;

/**
 * Lifecycle change of the underlying byte stream.
 *
 * @param cause failure behind a {@link State#DOWN} transition; {@code null}
 *              for an orderly shutdown and for {@link State#UP}
 */
public record DapTransportEvent(
    Instant timestamp,
    State state,
    Throwable cause
) {
    public enum State {
        UP,
        DOWN
    }
}
