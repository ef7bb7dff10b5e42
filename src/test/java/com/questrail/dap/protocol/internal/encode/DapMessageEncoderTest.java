package com.questrail.dap.protocol.internal.encode;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.dap.protocol.model.Event;
import com.questrail.dap.protocol.model.Request;
import com.questrail.dap.protocol.model.Response;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class DapMessageEncoderTest
{
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final DapMessageEncoder encoder = new DapMessageEncoder();

    @Test
    void requestPutsSeqAndTypeFirst()
    {
        ObjectNode args = JSON.objectNode().put("expr", "1+1");

        String json = encoder.encode(new Request(1, "evaluate", args));

        assertEquals("{\"seq\":1,\"type\":\"request\",\"command\":\"evaluate\",\"arguments\":{\"expr\":\"1+1\"}}", json);
    }

    @Test
    void requestOmitsAbsentOrEmptyArguments()
    {
        String expected = "{\"seq\":3,\"type\":\"request\",\"command\":\"threads\"}";

        assertEquals(expected, encoder.encode(new Request(3, "threads", null)));
        assertEquals(expected, encoder.encode(new Request(3, "threads", JSON.objectNode())));
        assertEquals(expected, encoder.encode(new Request(3, "threads", JSON.nullNode())));
        assertEquals(expected, encoder.encode(new Request(3, "threads", JSON.arrayNode())));
    }

    @Test
    void responseCarriesCorrelationFields()
    {
        ObjectNode body = JSON.objectNode().put("result", "2");

        String json = encoder.encode(new Response(7, 1, "evaluate", true, null, body));

        assertEquals("{\"seq\":7,\"type\":\"response\",\"request_seq\":1,\"command\":\"evaluate\","
                + "\"success\":true,\"body\":{\"result\":\"2\"}}", json);
    }

    @Test
    void failedResponseCarriesMessage()
    {
        String json = encoder.encode(new Response(2, 1, "launch", false, "no program", null));

        assertEquals("{\"seq\":2,\"type\":\"response\",\"request_seq\":1,\"command\":\"launch\","
                + "\"success\":false,\"message\":\"no program\"}", json);
    }

    @Test
    void eventWithAndWithoutBody()
    {
        assertEquals("{\"seq\":4,\"type\":\"event\",\"event\":\"initialized\"}",
                encoder.encode(new Event(4, "initialized", null)));
        assertEquals("{\"seq\":5,\"type\":\"event\",\"event\":\"output\",\"body\":{\"output\":\"hi\"}}",
                encoder.encode(new Event(5, "output", JSON.objectNode().put("output", "hi"))));
    }

    @Test
    void hasEntriesOnlyForNonEmptyContainers()
    {
        assertFalse(DapMessageEncoder.hasEntries(null));
        assertFalse(DapMessageEncoder.hasEntries(JSON.textNode("x")));
        assertFalse(DapMessageEncoder.hasEntries(JSON.objectNode()));
        assertTrue(DapMessageEncoder.hasEntries(JSON.arrayNode().add(1)));
    }
}
