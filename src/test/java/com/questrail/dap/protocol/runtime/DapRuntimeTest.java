package com.questrail.dap.protocol.runtime;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.dap.protocol.config.DapTransportConfig;
import com.questrail.dap.protocol.model.Event;
import com.questrail.dap.protocol.model.Response;
import com.questrail.dap.protocol.observability.DapTransportEvent;
import com.questrail.dap.protocol.observability.RecordingObservabilitySink;
import com.questrail.dap.protocol.transport.FakeByteStreamEndpoint;
import org.junit.jupiter.api.Test;

import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DapRuntimeTest {

    @Test
    void stdioLoopbackDeliversOwnEvents() throws Exception {
        // The runtime's output is piped straight back into its input.
        PipedInputStream in = new PipedInputStream(1 << 16);
        PipedOutputStream out = new PipedOutputStream(in);

        DapRuntime runtime = DapRuntime.builder()
            .withStdio(in, out)
            .withConfig(DapTransportConfig.builder().withConnectionName("loop").withTraceWire(true).build())
            .build();

        CompletableFuture<Event> received = new CompletableFuture<>();
        runtime.protocol().events().subscribe(received::complete);
        runtime.start();
        try {
            runtime.protocol().sendEvent("initialized", null);

            Event event = received.get(5, TimeUnit.SECONDS);
            assertEquals("initialized", event.event());
            assertEquals(1, event.seq());
        } finally {
            runtime.stop();
        }
        assertTrue(runtime.protocol().isClosed());
    }

    @Test
    void stdioRequestIsAnsweredByPeer() throws Exception {
        PipedInputStream toAdapter = new PipedInputStream(1 << 16);
        PipedOutputStream clientOut = new PipedOutputStream(toAdapter);
        PipedInputStream clientIn = new PipedInputStream(1 << 16);
        PipedOutputStream clientSide = new PipedOutputStream(clientIn);

        // "adapter" answers every request; "client" asks.
        DapRuntime adapter = DapRuntime.builder()
            .withStdio(toAdapter, clientSide)
            .withConfig(DapTransportConfig.builder().withConnectionName("adapter").build())
            .build();
        DapRuntime client = DapRuntime.builder()
            .withStdio(clientIn, clientOut)
            .withConfig(DapTransportConfig.builder().withConnectionName("client").build())
            .build();

        adapter.protocol().requests().subscribe(request -> adapter.protocol().sendResponse(
            Response.success(request, JsonNodeFactory.instance.objectNode().put("result", "2"))));
        adapter.start();
        client.start();
        try {
            Response response = client.protocol()
                .request("evaluate", JsonNodeFactory.instance.objectNode().put("expression", "1+1"))
                .get(5, TimeUnit.SECONDS);

            assertTrue(response.success());
            assertEquals(1, response.requestSeq());
            assertEquals("2", response.body().get("result").asText());
        } finally {
            client.stop();
            adapter.stop();
        }
    }

    @Test
    void customEndpointLifecycleIsReported() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        FakeByteStreamEndpoint endpoint = new FakeByteStreamEndpoint();
        DapRuntime runtime = DapRuntime.builder()
            .withEndpoint(endpoint)
            .withConfig(DapTransportConfig.builder().withObservabilitySink(sink).build())
            .build();

        CopyOnWriteArrayList<Event> events = new CopyOnWriteArrayList<>();
        runtime.protocol().events().subscribe(events::add);
        runtime.start();
        endpoint.inject("Content-Length: 36\r\n\r\n{\"seq\":1,\"type\":\"event\",\"event\":\"x\"}"
            .getBytes(StandardCharsets.UTF_8));
        runtime.close();

        assertEquals(1, events.size());
        assertEquals(DapTransportEvent.State.UP, sink.getTransportEvents().get(0).state());
        assertEquals(DapTransportEvent.State.DOWN, sink.getTransportEvents().get(1).state());
    }

    @Test
    void buildWithoutEndpointFails() {
        assertThrows(IllegalStateException.class, () -> DapRuntime.builder().build());
    }
}
