package com.questrail.dap.protocol.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * MessageChannel
 * -----------------------------------------------------------------------------
 * Minimal publish/subscribe channel with any number of independent subscribers.
 *
 * <p>Delivery is synchronous: {@link #publish} returns after every subscriber
 * registered at the time of the call has been invoked, in registration order.
 * A subscriber that throws is logged and skipped; the remaining subscribers
 * still receive the value and the publisher never sees the exception.</p>
 *
 * <p>Subscribing and cancelling are safe from any thread, including from
 * inside a subscriber.</p>
 *
 * @param <T> published value type
 */
public final class MessageChannel<T> implements MessageSource<T>
{
    private static final Logger log = LoggerFactory.getLogger(MessageChannel.class);

    private final String name;
    private final CopyOnWriteArrayList<Entry> subscribers = new CopyOnWriteArrayList<>();

    public MessageChannel(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public Subscription subscribe(Consumer<? super T> subscriber)
    {
        Entry entry = new Entry(Objects.requireNonNull(subscriber, "subscriber"));
        subscribers.add(entry);
        return entry;
    }

    public void publish(T value)
    {
        Objects.requireNonNull(value, "value");
        for (Entry entry : subscribers) {
            try {
                entry.subscriber.accept(value);
            }
            catch (RuntimeException e) {
                log.warn("Subscriber on channel '{}' failed", name, e);
            }
        }
    }

    public int subscriberCount()
    {
        return subscribers.size();
    }

    public String name()
    {
        return name;
    }

    private final class Entry implements Subscription
    {
        private final Consumer<? super T> subscriber;

        private Entry(Consumer<? super T> subscriber)
        {
            this.subscriber = subscriber;
        }

        @Override
        public boolean cancel()
        {
            return subscribers.remove(this);
        }
    }
}
