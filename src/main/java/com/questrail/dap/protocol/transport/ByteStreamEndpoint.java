package com.questrail.dap.protocol.transport;

import java.util.concurrent.CompletableFuture;

/**
 * ByteStreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a bidirectional byte stream (process stdio, pipe, TCP socket).
 *
 * <p>This endpoint is intentionally small. Higher layers are responsible for:</p>
 * <ul>
 *   <li>feeding inbound bytes into the frame decoder</li>
 *   <li>producing complete frames for {@link #write(byte[])}</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, blocking streams, or a test harness.</p>
 */
public interface ByteStreamEndpoint
{
    /**
     * Start the endpoint and begin receiving bytes.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link ByteStreamEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link ByteStreamEndpointListener#onTransportDown(Throwable)} at most once
     * per transition.</p>
     */
    void stop();

    /**
     * Write one complete frame.
     *
     * <p>The array is written as a single unit: bytes of two frames written from
     * different threads must never interleave.</p>
     *
     * <p>A failure detected before this method returns is thrown. A failure
     * detected later, e.g. by an asynchronous socket, completes the returned
     * future exceptionally. Blocking implementations return an already
     * completed future.</p>
     *
     * @param frame header and body bytes
     * @return completes when the frame has been handed to the underlying sink
     * @throws IllegalStateException if the endpoint is not started
     * @throws java.io.UncheckedIOException if the underlying sink rejects the write
     */
    CompletableFuture<Void> write(byte[] frame);

    /**
     * Register the listener that receives inbound bytes and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(ByteStreamEndpointListener listener);
}
