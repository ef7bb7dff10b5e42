package com.questrail.dap.protocol.codec;

/**
 * Receives the output of a {@link DapFrameDecoder}.
 */
public interface DapFrameListener
{
    /**
     * Called once per complete, non-empty frame body, in arrival order.
     *
     * @param body the body decoded as UTF-8 text
     */
    void onFrame(String body);

    /**
     * Called when a complete header block carried no usable
     * {@code Content-Length} and was dropped. This is not an error.
     *
     * @param headerText the discarded header text, without the separator
     */
    default void onHeaderDiscarded(String headerText)
    {
    }
}
