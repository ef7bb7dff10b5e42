package com.questrail.dap.protocol.observability;

import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters for one transport instance.
 *
 * <p>Conditions that are silently recovered on the wire (discarded headers,
 * unmatched responses) are counted here so they remain visible when debugging
 * a production connection.</p>
 */
public final class TransportStats {
    private final LongAdder messagesSent = new LongAdder();
    private final LongAdder framesDecoded = new LongAdder();
    private final LongAdder headersDiscarded = new LongAdder();
    private final LongAdder unmatchedResponses = new LongAdder();
    private final LongAdder unknownMessages = new LongAdder();
    private final LongAdder decodeErrors = new LongAdder();

    public void recordMessageSent() {
        messagesSent.increment();
    }

    public void recordFrameDecoded() {
        framesDecoded.increment();
    }

    public void recordHeaderDiscarded() {
        headersDiscarded.increment();
    }

    public void recordUnmatchedResponse() {
        unmatchedResponses.increment();
    }

    public void recordUnknownMessage() {
        unknownMessages.increment();
    }

    public void recordDecodeError() {
        decodeErrors.increment();
    }

    public long messagesSent() {
        return messagesSent.sum();
    }

    public long framesDecoded() {
        return framesDecoded.sum();
    }

    public long headersDiscarded() {
        return headersDiscarded.sum();
    }

    public long unmatchedResponses() {
        return unmatchedResponses.sum();
    }

    public long unknownMessages() {
        return unknownMessages.sum();
    }

    public long decodeErrors() {
        return decodeErrors.sum();
    }

    @Override
    public String toString() {
        return "TransportStats[sent=" + messagesSent()
                + ", decoded=" + framesDecoded()
                + ", headersDiscarded=" + headersDiscarded()
                + ", unmatchedResponses=" + unmatchedResponses()
                + ", unknownMessages=" + unknownMessages()
                + ", decodeErrors=" + decodeErrors() + "]";
    }
}
