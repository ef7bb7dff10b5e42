package com.questrail.dap.protocol.channel;

import java.util.function.Consumer;

/**
 * Subscribe-only view of a {@link MessageChannel}.
 *
 * @param <T> published value type
 */
public interface MessageSource<T>
{
    /**
     * Register a subscriber. Subscribers receive values in publish order, on the
     * publishing thread. Subscribing the same consumer twice yields two
     * independent subscriptions.
     */
    Subscription subscribe(Consumer<? super T> subscriber);
}
