package com.questrail.dap.protocol.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageModelTest {

    @Test
    void successResponseEchoesRequestSeqAndCommand() {
        Request request = new Request(12, "threads", null);

        Response response = Response.success(request, JsonNodeFactory.instance.objectNode());

        assertEquals(ProtocolMessage.UNSENT, response.seq());
        assertEquals(12, response.requestSeq());
        assertEquals("threads", response.command());
        assertTrue(response.success());
        assertNull(response.message());
    }

    @Test
    void failureResponseCarriesMessageAndNoBody() {
        Response response = Response.failure(new Request(3, "pause", null), "not running");

        assertFalse(response.success());
        assertEquals("not running", response.message());
        assertNull(response.body());
    }

    @Test
    void withSeqReturnsStampedCopy() {
        Event unsent = Event.of("stopped", null);

        Event sent = unsent.withSeq(9);

        assertEquals(ProtocolMessage.UNSENT, unsent.seq());
        assertEquals(9, sent.seq());
        assertEquals(MessageType.EVENT, sent.type());
    }

    @Test
    void wireNamesResolveBothWays() {
        for (MessageType type : MessageType.values()) {
            assertEquals(type, MessageType.fromWireName(type.wireName()).orElseThrow());
        }
        assertTrue(MessageType.fromWireName("Request").isEmpty());
        assertTrue(MessageType.fromWireName(null).isEmpty());
    }
}
