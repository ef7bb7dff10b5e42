package com.questrail.dap.protocol.codec.impl;

import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * ReceiveBuffer
 * -----------------------------------------------------------------------------
 * Grow-only byte arena holding received bytes that have not been consumed yet.
 *
 * <p>Readable bytes live in {@code [readIndex, writeIndex)}. Consuming from the
 * front only advances {@code readIndex}. Space is reclaimed lazily: when an
 * append does not fit after {@code writeIndex}, the readable region is first
 * compacted to the start of the array and the array grows only if that is still
 * not enough. A fully drained buffer rewinds both indices to zero.</p>
 *
 * <p>Not thread-safe. Owned by a single decoder.</p>
 */
final class ReceiveBuffer
{
    private byte[] data;
    private int readIndex;
    private int writeIndex;

    ReceiveBuffer(int initialCapacity)
    {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.data = new byte[initialCapacity];
    }

    void append(byte[] src, int offset, int length)
    {
        if (offset < 0 || length < 0 || offset > src.length - length) {
            throw new IndexOutOfBoundsException(
                    "offset=" + offset + " length=" + length + " size=" + src.length);
        }
        if (length == 0) {
            return;
        }
        ensureWritable(length);
        System.arraycopy(src, offset, data, writeIndex, length);
        writeIndex += length;
    }

    int readableBytes()
    {
        return writeIndex - readIndex;
    }

    int capacity()
    {
        return data.length;
    }

    /**
     * Position of the first occurrence of {@code pattern}, relative to the first
     * readable byte, or {@code -1}.
     */
    int indexOf(byte[] pattern)
    {
        int last = writeIndex - pattern.length;
        outer:
        for (int i = readIndex; i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i - readIndex;
        }
        return -1;
    }

    /**
     * Decode and consume the next {@code length} readable bytes.
     */
    String readString(int length, Charset charset)
    {
        checkReadable(length);
        String s = new String(data, readIndex, length, charset);
        skip(length);
        return s;
    }

    void skip(int length)
    {
        checkReadable(length);
        readIndex += length;
        if (readIndex == writeIndex) {
            readIndex = 0;
            writeIndex = 0;
        }
    }

    private void checkReadable(int length)
    {
        if (length < 0 || length > readableBytes()) {
            throw new IndexOutOfBoundsException(
                    "length=" + length + " readable=" + readableBytes());
        }
    }

    private void ensureWritable(int length)
    {
        if (data.length - writeIndex >= length) {
            return;
        }

        int readable = readableBytes();
        int required = readable + length;
        if (required < 0) {
            throw new IllegalStateException("Receive buffer would exceed maximum array size");
        }

        if (required <= data.length) {
            // Compact in place.
            System.arraycopy(data, readIndex, data, 0, readable);
        }
        else {
            // Doubling may overflow for huge buffers; max() then falls back to required.
            int newCapacity = Math.max(required, data.length << 1);
            byte[] grown = new byte[newCapacity];
            System.arraycopy(data, readIndex, grown, 0, readable);
            data = grown;
        }
        readIndex = 0;
        writeIndex = readable;
    }

    @Override
    public String toString()
    {
        return "ReceiveBuffer[readable=" + readableBytes() + ", capacity=" + data.length + "]";
    }

    // Visible for tests.
    byte[] readableCopy()
    {
        return Arrays.copyOfRange(data, readIndex, writeIndex);
    }
}
