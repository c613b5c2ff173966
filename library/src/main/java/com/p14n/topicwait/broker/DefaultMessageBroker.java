package com.p14n.topicwait.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.topicwait.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process broker that fans each published message out to every subscriber
 * of its topic.
 *
 * <p>
 * Delivery runs on the publishing thread, so messages from one publisher reach
 * each subscriber in publish order. Subscribers are expected to hand the
 * message off quickly rather than process it inline.
 * </p>
 *
 * @param <T> The type of messages this broker carries
 */
public class DefaultMessageBroker<T> implements MessageBroker<T> {

    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageBroker.class);

    protected final ConcurrentHashMap<String, Set<MessageSubscriber<T>>> topicSubscribers = new ConcurrentHashMap<>();
    protected final AtomicBoolean closed = new AtomicBoolean(false);
    protected final BrokerMetrics metrics;

    public DefaultMessageBroker() {
        this(OpenTelemetry.noop(), "message_broker");
    }

    public DefaultMessageBroker(OpenTelemetry ot, String scopeName) {
        this.metrics = new BrokerMetrics(ot.getMeter(scopeName));
    }

    protected boolean canProcess(String topic, T message) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }

        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        // If no subscribers for this topic, message is silently dropped
        Set<MessageSubscriber<T>> subscribers = topicSubscribers.get(topic);
        return subscribers != null && !subscribers.isEmpty();
    }

    @Override
    public void publish(String topic, T message) {
        if (!canProcess(topic, message)) {
            return;
        }

        metrics.recordPublished(topic);

        Set<MessageSubscriber<T>> subscribers = topicSubscribers.get(topic);
        if (subscribers == null) {
            return;
        }
        for (MessageSubscriber<T> subscriber : subscribers) {
            try {
                subscriber.onMessage(message);
                metrics.recordReceived(topic);
            } catch (Exception e) {
                logger.atDebug()
                        .addArgument(topic)
                        .setCause(e)
                        .log("Subscriber failed on topic {}");
                try {
                    subscriber.onError(e);
                } catch (Exception onErrorFailure) {
                    logger.atWarn()
                            .addArgument(topic)
                            .setCause(onErrorFailure)
                            .log("Subscriber error handler failed on topic {}");
                }
            }
        }
    }

    @Override
    public boolean subscribe(String topic, MessageSubscriber<T> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }

        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        // Add inside the map update so a concurrent unsubscribe cannot drop the set
        AtomicBoolean addedFlag = new AtomicBoolean(false);
        topicSubscribers.compute(topic, (k, subscribers) -> {
            Set<MessageSubscriber<T>> set = subscribers == null ? new CopyOnWriteArraySet<>() : subscribers;
            addedFlag.set(set.add(subscriber));
            return set;
        });
        boolean added = addedFlag.get();

        if (added) {
            metrics.recordSubscriberAdded(topic);
        }

        return added;
    }

    @Override
    public boolean unsubscribe(String topic, MessageSubscriber<T> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        AtomicBoolean removed = new AtomicBoolean(false);
        topicSubscribers.computeIfPresent(topic, (k, subscribers) -> {
            removed.set(subscribers.remove(subscriber));
            return subscribers.isEmpty() ? null : subscribers;
        });
        if (removed.get()) {
            metrics.recordSubscriberRemoved(topic);
        }
        return removed.get();
    }

    /**
     * @return true once {@link #close()} has been called
     */
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closed.set(true);
        topicSubscribers.clear();
    }

}
