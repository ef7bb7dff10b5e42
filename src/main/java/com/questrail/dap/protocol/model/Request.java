package com.questrail.dap.protocol.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A request for the peer to execute {@code command}.
 *
 * <p>
 * {@code arguments} is an arbitrary JSON tree and may be {@code null}. The
 * encoder omits the field from the wire entirely when it is absent or has no
 * entries.
 * </p>
 */
public record Request(
        int seq,
        String command,
        JsonNode arguments
) implements ProtocolMessage
{
    public Request {
        Objects.requireNonNull(command, "command");
    }

    /**
     * Creates an unsent request.
     */
    public static Request of(String command, JsonNode arguments) {
        return new Request(UNSENT, command, arguments);
    }

    @Override
    public MessageType type() {
        return MessageType.REQUEST;
    }

    @Override
    public Request withSeq(int seq) {
        return new Request(seq, command, arguments);
    }
}
