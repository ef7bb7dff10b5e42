package com.questrail.dap.protocol.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Unsolicited notification named {@code event}, with an optional JSON body.
 */
public record Event(
        int seq,
        String event,
        JsonNode body
) implements ProtocolMessage
{
    public Event {
        Objects.requireNonNull(event, "event");
    }

    /**
     * Creates an unsent event.
     */
    public static Event of(String event, JsonNode body) {
        return new Event(UNSENT, event, body);
    }

    @Override
    public MessageType type() {
        return MessageType.EVENT;
    }

    @Override
    public Event withSeq(int seq) {
        return new Event(seq, event, body);
    }
}
