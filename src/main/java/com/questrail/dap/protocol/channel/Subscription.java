package com.questrail.dap.protocol.channel;

/**
 * Handle returned by {@link MessageSource#subscribe}.
 */
public interface Subscription
{
    /**
     * Stop delivering to the subscriber.
     *
     * @return {@code true} if the subscriber was removed; {@code false} if it
     *         was already cancelled
     */
    boolean cancel();
}
