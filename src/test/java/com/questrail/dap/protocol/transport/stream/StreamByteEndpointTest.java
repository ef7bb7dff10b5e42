package com.questrail.dap.protocol.transport.stream;

import com.questrail.dap.protocol.transport.ByteStreamEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StreamByteEndpointTest
{
    private final PipedOutputStream peerOut = new PipedOutputStream();
    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private StreamByteEndpoint endpoint;

    @AfterEach
    void tearDown()
    {
        if (endpoint != null) {
            endpoint.stop();
        }
    }

    @Test
    void deliversInboundBytesAndReportsEndOfStreamOnce() throws Exception
    {
        endpoint = new StreamByteEndpoint(new PipedInputStream(peerOut), written, "test");
        RecordingListener listener = new RecordingListener();
        endpoint.setListener(listener);

        endpoint.start();
        peerOut.write("hello".getBytes(StandardCharsets.US_ASCII));
        peerOut.flush();
        peerOut.close();

        assertTrue(listener.downLatch.await(5, TimeUnit.SECONDS));
        assertEquals("hello", listener.received.toString(StandardCharsets.US_ASCII));
        assertEquals(1, listener.ups.get());

        endpoint.stop();
        assertEquals(1, listener.downs.get());
    }

    @Test
    void failingListenerDoesNotStopReader() throws Exception
    {
        endpoint = new StreamByteEndpoint(new PipedInputStream(peerOut), written, "test");
        RecordingListener recorder = new RecordingListener();
        AtomicInteger calls = new AtomicInteger();
        endpoint.setListener(new ByteStreamEndpointListener()
        {
            @Override
            public void onTransportUp()
            {
                recorder.onTransportUp();
            }

            @Override
            public void onTransportDown(Throwable cause)
            {
                recorder.onTransportDown(cause);
            }

            @Override
            public void onBytes(byte[] chunk)
            {
                if (calls.getAndIncrement() == 0) {
                    throw new IllegalStateException("listener bug");
                }
                recorder.onBytes(chunk);
            }
        });

        endpoint.start();
        peerOut.write('a');
        peerOut.flush();
        while (calls.get() == 0) {
            Thread.sleep(5);
        }
        peerOut.write('b');
        peerOut.flush();
        peerOut.close();

        assertTrue(recorder.downLatch.await(5, TimeUnit.SECONDS));
        assertEquals("b", recorder.received.toString(StandardCharsets.US_ASCII));
    }

    @Test
    void writesGoToOutputStream() throws Exception
    {
        endpoint = new StreamByteEndpoint(new PipedInputStream(peerOut), written, "test");
        endpoint.setListener(new RecordingListener());
        endpoint.start();

        endpoint.write("Content-Length: 2\r\n\r\n{}".getBytes(StandardCharsets.US_ASCII));

        assertEquals("Content-Length: 2\r\n\r\n{}", written.toString(StandardCharsets.US_ASCII));
    }

    @Test
    void writeBeforeStartIsRejected() throws IOException
    {
        endpoint = new StreamByteEndpoint(new PipedInputStream(peerOut), written, "test");
        endpoint.setListener(new RecordingListener());

        assertThrows(IllegalStateException.class, () -> endpoint.write(new byte[] {1}));
    }

    @Test
    void startRequiresListenerAndIsOneShot() throws IOException
    {
        endpoint = new StreamByteEndpoint(new PipedInputStream(peerOut), written, "test");
        assertThrows(IllegalStateException.class, endpoint::start);

        endpoint.setListener(new RecordingListener());
        endpoint.start();
        assertThrows(IllegalStateException.class, endpoint::start);
    }

    private static final class RecordingListener implements ByteStreamEndpointListener
    {
        final ByteArrayOutputStream received = new ByteArrayOutputStream();
        final AtomicInteger ups = new AtomicInteger();
        final AtomicInteger downs = new AtomicInteger();
        final CountDownLatch downLatch = new CountDownLatch(1);

        @Override
        public void onTransportUp()
        {
            ups.incrementAndGet();
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            downs.incrementAndGet();
            downLatch.countDown();
        }

        @Override
        public synchronized void onBytes(byte[] chunk)
        {
            received.writeBytes(chunk);
        }
    }
}
