package com.questrail.dap.protocol.codec.impl;

import com.questrail.dap.protocol.codec.DapFrameDecoder;
import com.questrail.dap.protocol.codec.DapFrameListener;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ContentLengthFrameDecoder
 * -----------------------------------------------------------------------------
 * Incremental {@link DapFrameDecoder} for {@code Content-Length} framing.
 *
 * <p>The decoder alternates between two states:</p>
 * <ol>
 *   <li><strong>Awaiting header</strong>: wait for {@code \r\n\r\n}. Once present,
 *       look for {@code Content-Length: <digits>} in the text before it. If
 *       found, consume the header block and move to the body state. If not,
 *       drop the header block and keep scanning.</li>
 *   <li><strong>Awaiting body</strong>: wait until the declared number of bytes
 *       is buffered, consume exactly that many, emit them, and return to the
 *       header state.</li>
 * </ol>
 *
 * <p>Both states repeat over already buffered bytes until neither can make
 * progress, so every frame contained in one chunk is emitted before
 * {@link #decode} returns. A partial header is never acted upon. Zero-length
 * bodies are consumed but not emitted.</p>
 *
 * <p>Bytes are consumed before the listener is invoked, so a listener failure
 * never leaves the buffer mid-frame.</p>
 */
public final class ContentLengthFrameDecoder implements DapFrameDecoder
{
    public static final int DEFAULT_INITIAL_CAPACITY = 8192;

    private static final int AWAITING_HEADER = -1;

    private final ReceiveBuffer buffer;

    /** Declared length of the body being awaited, or {@link #AWAITING_HEADER}. */
    private int contentLength = AWAITING_HEADER;

    public ContentLengthFrameDecoder()
    {
        this(DEFAULT_INITIAL_CAPACITY);
    }

    public ContentLengthFrameDecoder(int initialCapacity)
    {
        this.buffer = new ReceiveBuffer(initialCapacity);
    }

    @Override
    public void decode(byte[] chunk, int offset, int length, DapFrameListener listener)
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(listener, "listener");

        buffer.append(chunk, offset, length);

        while (true) {
            if (contentLength != AWAITING_HEADER) {
                if (buffer.readableBytes() < contentLength) {
                    return;
                }
                final String body = buffer.readString(contentLength, StandardCharsets.UTF_8);
                contentLength = AWAITING_HEADER;
                if (!body.isEmpty()) {
                    listener.onFrame(body);
                }
                continue;
            }

            final int separatorAt = buffer.indexOf(ContentLengthHeader.SEPARATOR);
            if (separatorAt < 0) {
                return;
            }

            final String header = buffer.readString(separatorAt, StandardCharsets.UTF_8);
            buffer.skip(ContentLengthHeader.SEPARATOR.length);

            OptionalInt declared = ContentLengthHeader.parseContentLength(header);
            if (declared.isPresent()) {
                contentLength = declared.getAsInt();
            }
            else {
                listener.onHeaderDiscarded(header);
            }
        }
    }

    @Override
    public int bufferedBytes()
    {
        return buffer.readableBytes();
    }

    /**
     * True while a header has been parsed and its body is still incomplete.
     */
    public boolean awaitingBody()
    {
        return contentLength != AWAITING_HEADER;
    }
}
