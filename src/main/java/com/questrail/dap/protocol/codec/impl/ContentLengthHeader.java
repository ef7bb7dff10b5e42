package com.questrail.dap.protocol.codec.impl;

import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ContentLengthHeader
 * -----------------------------------------------------------------------------
 * Header rules of the DAP wire format.
 *
 * <p>A header block is terminated by two CRLF pairs. Within the block the only
 * recognized field is {@code Content-Length: <digits>}; its value is the byte
 * length of the body that immediately follows the separator.</p>
 */
final class ContentLengthHeader
{
    /** Header block terminator ({@code \r\n\r\n}). */
    static final byte[] SEPARATOR = "\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    static final String FIELD_PREFIX = "Content-Length: ";

    private static final Pattern CONTENT_LENGTH = Pattern.compile("Content-Length: (\\d+)");

    private ContentLengthHeader() {}

    /**
     * Render the complete header block, separator included, for a body of
     * {@code bodyLength} bytes.
     */
    static byte[] format(int bodyLength)
    {
        if (bodyLength < 0) {
            throw new IllegalArgumentException("bodyLength must not be negative: " + bodyLength);
        }
        String header = FIELD_PREFIX + bodyLength + "\r\n\r\n";
        return header.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Extract the declared body length from a header block.
     *
     * @param headerText header text preceding the separator
     * @return the declared length; empty if the field is missing or its value
     *         does not fit an {@code int}
     */
    static OptionalInt parseContentLength(String headerText)
    {
        Matcher m = CONTENT_LENGTH.matcher(headerText);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        }
        catch (NumberFormatException e) {
            // More digits than an int can hold; nothing sane can follow.
            return OptionalInt.empty();
        }
    }
}
