package com.questrail.dap.protocol.observability;

import java.time.Instant;

/**
 * A condition the transport recovered from on its own.
 */
public record DapDiagnosticEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        /** A header block without a usable Content-Length was dropped. */
        HEADER_DISCARDED,
        /** A response arrived for a request that is not pending. */
        UNMATCHED_RESPONSE,
        /** A well-formed body was not an object of a known message type. */
        UNKNOWN_MESSAGE,
        /** Pending request handlers were discarded at teardown. */
        PENDING_DROPPED
    }
}
