package com.questrail.dap.protocol.transport.tcp.netty;

import com.questrail.dap.protocol.transport.ByteStreamEndpointListener;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trip against a plain blocking socket on the loopback interface.
 */
class NettyTcpByteStreamEndpointTest
{
    private static final String OUTBOUND = "Content-Length: 2\r\n\r\n{}";
    private static final String INBOUND = "Content-Length: 4\r\n\r\nnull";

    @Test
    void connectsWritesReceivesAndReportsDown() throws Exception
    {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            NettyTcpByteStreamEndpoint endpoint = new NettyTcpByteStreamEndpoint(
                    new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()));
            RecordingListener listener = new RecordingListener(INBOUND.length());
            endpoint.setListener(listener);

            endpoint.start();
            try (Socket peer = server.accept()) {
                assertTrue(listener.up.await(5, TimeUnit.SECONDS));

                endpoint.write(OUTBOUND.getBytes(StandardCharsets.US_ASCII));
                InputStream in = peer.getInputStream();
                byte[] got = in.readNBytes(OUTBOUND.length());
                assertEquals(OUTBOUND, new String(got, StandardCharsets.US_ASCII));

                OutputStream out = peer.getOutputStream();
                out.write(INBOUND.getBytes(StandardCharsets.US_ASCII));
                out.flush();
                assertTrue(listener.allBytes.await(5, TimeUnit.SECONDS));
                assertEquals(INBOUND, listener.text());
            }

            assertTrue(listener.down.await(5, TimeUnit.SECONDS));
            endpoint.stop();
        }
    }

    @Test
    void writeBeforeConnectIsRejected()
    {
        NettyTcpByteStreamEndpoint endpoint = new NettyTcpByteStreamEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), 1));
        try {
            assertThrows(IllegalStateException.class, () -> endpoint.write(new byte[] {1}));
        }
        finally {
            endpoint.stop();
        }
    }

    private static final class RecordingListener implements ByteStreamEndpointListener
    {
        private final ByteArrayOutputStream received = new ByteArrayOutputStream();
        private final int expected;
        final CountDownLatch up = new CountDownLatch(1);
        final CountDownLatch down = new CountDownLatch(1);
        final CountDownLatch allBytes = new CountDownLatch(1);

        RecordingListener(int expected)
        {
            this.expected = expected;
        }

        @Override
        public void onTransportUp()
        {
            up.countDown();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            down.countDown();
        }

        @Override
        public synchronized void onBytes(byte[] chunk)
        {
            received.writeBytes(chunk);
            if (received.size() >= expected) {
                allBytes.countDown();
            }
        }

        synchronized String text()
        {
            return received.toString(StandardCharsets.US_ASCII);
        }
    }
}
