package com.questrail.dap.protocol.config;

import com.questrail.dap.protocol.codec.impl.ContentLengthFrameDecoder;
import com.questrail.dap.protocol.observability.DapObservabilitySink;
import com.questrail.dap.protocol.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Configuration of a single DAP transport instance.
 *
 * @param connectionName      label used in logs for this connection
 * @param initialBufferCapacity starting size of the receive buffer, in bytes
 * @param pendingRequestPolicy  teardown behavior for unanswered requests
 * @param traceWire             log every frame through the {@code DAP.WIRE} logger
 * @param observabilitySink     receiver of errors, diagnostics and lifecycle events
 */
public record DapTransportConfig(
    String connectionName,
    int initialBufferCapacity,
    PendingRequestPolicy pendingRequestPolicy,
    boolean traceWire,
    DapObservabilitySink observabilitySink
) {
    public DapTransportConfig {
        Objects.requireNonNull(connectionName, "connectionName");
        Objects.requireNonNull(pendingRequestPolicy, "pendingRequestPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (initialBufferCapacity <= 0) {
            throw new IllegalArgumentException("initialBufferCapacity must be positive: " + initialBufferCapacity);
        }
    }

    public static DapTransportConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String connectionName = "dap";
        private int initialBufferCapacity = ContentLengthFrameDecoder.DEFAULT_INITIAL_CAPACITY;
        private PendingRequestPolicy pendingRequestPolicy = PendingRequestPolicy.FAIL;
        private boolean traceWire = false;
        private DapObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withConnectionName(String connectionName) {
            this.connectionName = connectionName;
            return this;
        }

        public Builder withInitialBufferCapacity(int initialBufferCapacity) {
            this.initialBufferCapacity = initialBufferCapacity;
            return this;
        }

        public Builder withPendingRequestPolicy(PendingRequestPolicy policy) {
            this.pendingRequestPolicy = policy;
            return this;
        }

        public Builder withTraceWire(boolean traceWire) {
            this.traceWire = traceWire;
            return this;
        }

        public Builder withObservabilitySink(DapObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public DapTransportConfig build() {
            return new DapTransportConfig(
                connectionName, initialBufferCapacity, pendingRequestPolicy, traceWire, observabilitySink);
        }
    }
}
