package com.questrail.dap.protocol.codec.impl;

import com.questrail.dap.protocol.codec.DapFrameEncoder;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * ContentLengthFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link DapFrameEncoder}.
 *
 * <p>The mechanical inverse of {@link ContentLengthFrameDecoder}: the body is
 * encoded as UTF-8, its <em>byte</em> count becomes the header value, and
 * header and body are returned in one array with nothing in between and nothing
 * after the body.</p>
 */
public final class ContentLengthFrameEncoder implements DapFrameEncoder
{
    @Override
    public byte[] encode(String body)
    {
        Objects.requireNonNull(body, "body");

        final byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        final byte[] header = ContentLengthHeader.format(payload.length);

        byte[] frame = new byte[header.length + payload.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(payload, 0, frame, header.length, payload.length);
        return frame;
    }
}
