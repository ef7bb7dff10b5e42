package com.questrail.dap.protocol.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Answer to a {@link Request}.
 *
 * <p>
 * {@code requestSeq} is the {@code seq} of the request being answered and is
 * the only key used to correlate the response with its originating request.
 * {@code message} carries the error text when {@code success} is false;
 * {@code body} carries the command-specific result. Both may be {@code null}.
 * </p>
 *
 * <p>
 * A response may be sent at most once. An instance whose {@code seq} is not
 * {@link ProtocolMessage#UNSENT} has already been sent and is rejected by the
 * transport.
 * </p>
 */
public record Response(
        int seq,
        int requestSeq,
        String command,
        boolean success,
        String message,
        JsonNode body
) implements ProtocolMessage
{
    public Response {
        Objects.requireNonNull(command, "command");
    }

    /**
     * Creates an unsent successful response to {@code request}.
     */
    public static Response success(Request request, JsonNode body) {
        Objects.requireNonNull(request, "request");
        return new Response(UNSENT, request.seq(), request.command(), true, null, body);
    }

    /**
     * Creates an unsent failed response to {@code request}.
     */
    public static Response failure(Request request, String message) {
        Objects.requireNonNull(request, "request");
        return new Response(UNSENT, request.seq(), request.command(), false, message, null);
    }

    @Override
    public MessageType type() {
        return MessageType.RESPONSE;
    }

    @Override
    public Response withSeq(int seq) {
        return new Response(seq, requestSeq, command, success, message, body);
    }
}
