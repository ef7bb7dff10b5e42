package com.questrail.dap.protocol.internal.encode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.dap.protocol.model.Event;
import com.questrail.dap.protocol.model.ProtocolMessage;
import com.questrail.dap.protocol.model.Request;
import com.questrail.dap.protocol.model.Response;

import java.util.Objects;

/**
 * DapMessageEncoder
 * ============================================================================
 * Converts a semantic {@link ProtocolMessage} into its JSON body text.
 *
 * <p>The outbound pipeline is:</p>
 * <pre>
 *   ProtocolMessage  -&gt;  String (JSON)  -&gt;  byte[] frame
 *         (this)             (frame encoder)
 * </pre>
 *
 * <h2>Field layout</h2>
 * <p>{@code seq} and {@code type} always come first, followed by the
 * type-specific fields:</p>
 * <ul>
 *   <li>request: {@code command}, {@code arguments}</li>
 *   <li>response: {@code request_seq}, {@code command}, {@code success},
 *       {@code message}, {@code body}</li>
 *   <li>event: {@code event}, {@code body}</li>
 * </ul>
 *
 * <p>Optional fields that are {@code null} are left out. Request
 * {@code arguments} are also left out when they have no entries.</p>
 */
public final class DapMessageEncoder
{
    private final ObjectMapper mapper;

    public DapMessageEncoder() {
        this(new ObjectMapper());
    }

    public DapMessageEncoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public String encode(ProtocolMessage message) {
        Objects.requireNonNull(message, "message");

        ObjectNode node = mapper.createObjectNode();
        node.put("seq", message.seq());
        node.put("type", message.type().wireName());

        if (message instanceof Request request) {
            node.put("command", request.command());
            if (hasEntries(request.arguments())) {
                node.set("arguments", request.arguments());
            }
        }
        else if (message instanceof Response response) {
            node.put("request_seq", response.requestSeq());
            node.put("command", response.command());
            node.put("success", response.success());
            if (response.message() != null) {
                node.put("message", response.message());
            }
            putIfPresent(node, "body", response.body());
        }
        else if (message instanceof Event event) {
            node.put("event", event.event());
            putIfPresent(node, "body", event.body());
        }

        try {
            return mapper.writeValueAsString(node);
        }
        catch (JsonProcessingException e) {
            throw new DapEncodeException("Failed to serialize " + message.type().wireName(), e);
        }
    }

    /**
     * Only non-empty objects and arrays count as carrying arguments.
     */
    static boolean hasEntries(JsonNode arguments) {
        return arguments != null
                && arguments.isContainerNode()
                && arguments.size() > 0;
    }

    private static void putIfPresent(ObjectNode node, String field, JsonNode value) {
        if (value != null && !value.isMissingNode()) {
            node.set(field, value);
        }
    }
}
