package com.questrail.dap.protocol.config;

import com.questrail.dap.protocol.observability.NullObservabilitySink;
import com.questrail.dap.protocol.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DapTransportConfigTest {

    @Test
    void defaultsAreUsable() {
        DapTransportConfig config = DapTransportConfig.defaults();

        assertEquals("dap", config.connectionName());
        assertEquals(8192, config.initialBufferCapacity());
        assertEquals(PendingRequestPolicy.FAIL, config.pendingRequestPolicy());
        assertFalse(config.traceWire());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
    }

    @Test
    void builderOverridesEveryField() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        DapTransportConfig config = DapTransportConfig.builder()
            .withConnectionName("lldb")
            .withInitialBufferCapacity(64)
            .withPendingRequestPolicy(PendingRequestPolicy.DROP)
            .withTraceWire(true)
            .withObservabilitySink(sink)
            .build();

        assertEquals("lldb", config.connectionName());
        assertEquals(64, config.initialBufferCapacity());
        assertEquals(PendingRequestPolicy.DROP, config.pendingRequestPolicy());
        assertTrue(config.traceWire());
        assertSame(sink, config.observabilitySink());
    }

    @Test
    void rejectsNonPositiveBufferCapacity() {
        assertThrows(IllegalArgumentException.class,
            () -> DapTransportConfig.builder().withInitialBufferCapacity(0).build());
    }

    @Test
    void rejectsMissingCollaborators() {
        assertThrows(NullPointerException.class,
            () -> DapTransportConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class,
            () -> DapTransportConfig.builder().withPendingRequestPolicy(null).build());
    }
}
