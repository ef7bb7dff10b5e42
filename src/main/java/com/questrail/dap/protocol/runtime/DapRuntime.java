package com.questrail.dap.protocol.runtime;

import com.questrail.dap.protocol.DebugAdapterProtocol;
import com.questrail.dap.protocol.config.DapTransportConfig;
import com.questrail.dap.protocol.transport.ByteStreamEndpoint;
import com.questrail.dap.protocol.transport.stream.StreamByteEndpoint;
import com.questrail.dap.protocol.transport.tcp.netty.NettyTcpByteStreamEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * DapRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one DAP connection.
 *
 * <p>Wires a {@link ByteStreamEndpoint} to a {@link DebugAdapterProtocol} and
 * owns both lifecycles. No protocol semantics live here.</p>
 *
 * <pre>
 *   DapRuntime runtime = DapRuntime.builder()
 *       .withStdio(process.getInputStream(), process.getOutputStream())
 *       .withConfig(DapTransportConfig.builder().withTraceWire(true).build())
 *       .build();
 *   runtime.protocol().events().subscribe(e -&gt; ...);
 *   runtime.start();
 * </pre>
 *
 * <p>Subscribe before {@link #start()} to see the first inbound messages.</p>
 */
public final class DapRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DapRuntime.class);

    private final DebugAdapterProtocol protocol;
    private final ByteStreamEndpoint endpoint;

    private DapRuntime(DebugAdapterProtocol protocol, ByteStreamEndpoint endpoint) {
        this.protocol = protocol;
        this.endpoint = endpoint;
    }

    public void start() {
        log.info("Starting DAP connection '{}'", protocol.config().connectionName());
        endpoint.start();
    }

    /**
     * Close the protocol (failing or dropping pending requests) and then the
     * endpoint.
     */
    public void stop() {
        protocol.close();
        endpoint.stop();
        log.info("Stopped DAP connection '{}' {}", protocol.config().connectionName(), protocol.stats());
    }

    @Override
    public void close() {
        stop();
    }

    public DebugAdapterProtocol protocol() {
        return protocol;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DapTransportConfig config = DapTransportConfig.defaults();
        private ByteStreamEndpoint endpoint;
        private InputStream stdioIn;
        private OutputStream stdioOut;
        private InetSocketAddress tcpRemote;

        public Builder withConfig(DapTransportConfig config) {
            this.config = config;
            return this;
        }

        public Builder withEndpoint(ByteStreamEndpoint endpoint) {
            clearEndpoint();
            this.endpoint = endpoint;
            return this;
        }

        /**
         * Talk over a stream pair, e.g. the stdio of a debug adapter process.
         */
        public Builder withStdio(InputStream in, OutputStream out) {
            clearEndpoint();
            this.stdioIn = Objects.requireNonNull(in, "in");
            this.stdioOut = Objects.requireNonNull(out, "out");
            return this;
        }

        /**
         * Connect to a debug adapter listening on a TCP socket.
         */
        public Builder withTcpConnect(InetSocketAddress remoteAddress) {
            clearEndpoint();
            this.tcpRemote = Objects.requireNonNull(remoteAddress, "remoteAddress");
            return this;
        }

        private void clearEndpoint() {
            endpoint = null;
            stdioIn = null;
            stdioOut = null;
            tcpRemote = null;
        }

        public DapRuntime build() {
            Objects.requireNonNull(config, "config");

            ByteStreamEndpoint ep = endpoint;
            if (stdioIn != null) {
                ep = new StreamByteEndpoint(stdioIn, stdioOut, config.connectionName());
            } else if (tcpRemote != null) {
                ep = new NettyTcpByteStreamEndpoint(tcpRemote);
            }
            if (ep == null) {
                throw new IllegalStateException("An endpoint, stdio streams or a TCP address is required");
            }

            DebugAdapterProtocol protocol = new DebugAdapterProtocol(config);
            protocol.connect(ep);
            return new DapRuntime(protocol, ep);
        }
    }
}
