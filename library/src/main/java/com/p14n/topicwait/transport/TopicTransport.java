package com.p14n.topicwait.transport;

import java.time.Duration;

import com.p14n.topicwait.broker.MessageSubscriber;

/**
 * A node on a publish/subscribe transport. Arriving messages are queued by
 * the transport and only handed to handlers while someone pumps it, so the
 * thread calling {@link #pumpOnce(Duration)} is the thread handlers run on.
 */
public interface TopicTransport extends AutoCloseable {

    /**
     * Registers a handler for every message arriving on {@code topic}.
     *
     * @param topic       fully resolved topic name
     * @param messageType type messages on this topic are expected to have
     * @param handler     receives each message in arrival order
     * @return handle used to cancel the registration
     * @throws TransportException if the subscription cannot be created
     */
    <T> Subscription subscribe(String topic, Class<T> messageType, MessageSubscriber<T> handler);

    /**
     * Cancels a registration. Pending deliveries for it are discarded.
     *
     * @return true if the subscription was active
     */
    boolean unsubscribe(Subscription subscription);

    /**
     * Delivers pending messages to their handlers, waiting at most
     * {@code pollInterval} for the first one to arrive.
     *
     * @return true if at least one handler was invoked
     * @throws InterruptedException if interrupted while waiting
     */
    boolean pumpOnce(Duration pollInterval) throws InterruptedException;

    /**
     * Cancels every subscription and drops pending deliveries. Idempotent.
     */
    @Override
    void close();
}
