package com.questrail.dap.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic through a dedicated {@code DAP.WIRE} logger so that both
 * directions of a connection read the same way.
 */
public final class WireTrace {

    private static final Logger LOGGER = LoggerFactory.getLogger("DAP.WIRE");

    static final int MAX_BODY_CHARS = 200;

    private WireTrace() {
    }

    public static void rx(String connection, String body) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} len={} json={}", connection, body.length(), truncate(body, MAX_BODY_CHARS));
        }
    }

    public static void tx(String connection, int seq, String body) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} seq={} json={}", connection, seq, truncate(body, MAX_BODY_CHARS));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
