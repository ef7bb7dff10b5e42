package com.questrail.dap.protocol.internal.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.dap.protocol.model.Event;
import com.questrail.dap.protocol.model.MessageType;
import com.questrail.dap.protocol.model.ProtocolMessage;
import com.questrail.dap.protocol.model.Request;
import com.questrail.dap.protocol.model.Response;

import java.util.Objects;
import java.util.Optional;

/**
 * DapMessageDecoder
 * ============================================================================
 * Converts one complete frame body into a semantic {@link ProtocolMessage}.
 *
 * <h2>Outcomes</h2>
 * <ul>
 *   <li>Well-formed JSON object with a known {@code type}: the message</li>
 *   <li>Well-formed JSON that is not an object, or carries an unknown or missing
 *       {@code type}: {@link Optional#empty()}; the body is ignored</li>
 *   <li>Malformed JSON: {@link DapDecodeException}</li>
 * </ul>
 *
 * <p>Field access is lenient. A missing number reads as {@code 0}, a missing
 * string as the empty string, a missing or JSON-{@code null} payload as
 * {@code null}. In particular a response without {@code request_seq} simply
 * matches no pending request.</p>
 */
public final class DapMessageDecoder
{
    private final ObjectMapper mapper;

    public DapMessageDecoder() {
        this(new ObjectMapper());
    }

    public DapMessageDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<ProtocolMessage> decode(String body) {
        Objects.requireNonNull(body, "body");

        final JsonNode node;
        try {
            node = mapper.readTree(body);
        }
        catch (JsonProcessingException e) {
            throw new DapDecodeException("Malformed message body: " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            return Optional.empty();
        }

        Optional<MessageType> type = MessageType.fromWireName(node.path("type").asText(null));
        if (type.isEmpty()) {
            return Optional.empty();
        }

        final int seq = node.path("seq").asInt();
        switch (type.get()) {
            case REQUEST:
                return Optional.of(new Request(
                        seq,
                        node.path("command").asText(""),
                        payload(node, "arguments")));
            case RESPONSE:
                return Optional.of(new Response(
                        seq,
                        node.path("request_seq").asInt(),
                        node.path("command").asText(""),
                        node.path("success").asBoolean(),
                        node.path("message").asText(null),
                        payload(node, "body")));
            case EVENT:
                return Optional.of(new Event(
                        seq,
                        node.path("event").asText(""),
                        payload(node, "body")));
            default:
                return Optional.empty();
        }
    }

    private static JsonNode payload(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value;
    }
}
