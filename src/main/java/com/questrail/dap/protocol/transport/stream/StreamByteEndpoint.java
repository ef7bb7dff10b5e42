package com.questrail.dap.protocol.transport.stream;

import com.questrail.dap.protocol.transport.ByteStreamEndpoint;
import com.questrail.dap.protocol.transport.ByteStreamEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StreamByteEndpoint
 * =============================================================================
 * {@link ByteStreamEndpoint} over a blocking {@link InputStream} /
 * {@link OutputStream} pair, typically the stdio of a debug adapter process.
 *
 * <h2>Threading</h2>
 * A single daemon reader thread blocks on the input stream and delivers every
 * chunk it reads to the listener, in order. Writes happen on the caller's
 * thread and are serialized on the output stream.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} reports the transport up and starts the reader.</li>
 *   <li>End of input, a read failure, or {@link #stop()} reports it down,
 *       once.</li>
 *   <li>{@link #stop()} closes both streams.</li>
 * </ul>
 */
public final class StreamByteEndpoint implements ByteStreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(StreamByteEndpoint.class);

    static final int READ_CHUNK_SIZE = 8192;

    private final InputStream in;
    private final OutputStream out;
    private final String name;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean down = new AtomicBoolean();

    private volatile ByteStreamEndpointListener listener;
    private volatile boolean running;
    private Thread readerThread;

    public StreamByteEndpoint(InputStream in, OutputStream out, String name)
    {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public void setListener(ByteStreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        ByteStreamEndpointListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Endpoint '" + name + "' already started");
        }

        running = true;
        l.onTransportUp();

        readerThread = new Thread(this::readLoop, "dap-stream-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();
    }

    @Override
    public void stop()
    {
        running = false;
        closeQuietly(in);
        synchronized (out) {
            closeQuietly(out);
        }

        Thread t = readerThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(500);
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        reportDown(null);
    }

    @Override
    public CompletableFuture<Void> write(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (!running) {
            throw new IllegalStateException("Endpoint '" + name + "' is not running");
        }
        synchronized (out) {
            try {
                out.write(frame);
                out.flush();
            }
            catch (IOException e) {
                throw new UncheckedIOException("Write to '" + name + "' failed", e);
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    private void readLoop()
    {
        byte[] buf = new byte[READ_CHUNK_SIZE];
        Throwable failure = null;
        try {
            while (running) {
                int n = in.read(buf);
                if (n < 0) {
                    break;
                }
                if (n > 0) {
                    deliver(Arrays.copyOf(buf, n));
                }
            }
        }
        catch (IOException e) {
            if (running) {
                log.warn("Read from '{}' failed", name, e);
                failure = e;
            }
        }
        finally {
            running = false;
            reportDown(failure);
        }
    }

    // A failing listener must not end the reader thread.
    private void deliver(byte[] chunk)
    {
        try {
            listener.onBytes(chunk);
        }
        catch (RuntimeException e) {
            log.warn("Listener of '{}' failed on {} inbound bytes", name, chunk.length, e);
        }
    }

    private void reportDown(Throwable cause)
    {
        ByteStreamEndpointListener l = listener;
        if (l != null && started.get() && down.compareAndSet(false, true)) {
            l.onTransportDown(cause);
        }
    }

    private void closeQuietly(AutoCloseable c)
    {
        try {
            c.close();
        }
        catch (Exception e) {
            log.debug("Closing stream of '{}' failed", name, e);
        }
    }

    private ByteStreamEndpointListener requireListener()
    {
        ByteStreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("ByteStreamEndpointListener must be set before start()");
        }
        return l;
    }
}
