package com.p14n.topicwait.transport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.topicwait.broker.MessageBroker;
import com.p14n.topicwait.broker.MessageSubscriber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport node attached to a shared {@link MessageBroker}.
 *
 * <p>
 * Every subscription registers a bridge on the broker that only enqueues the
 * arriving message on this node's own pending queue. Handlers run when the
 * node is pumped, one delivery at a time and in arrival order.
 * </p>
 *
 * <pre>{@code
 * MessageBroker<Object> broker = new DefaultMessageBroker<>();
 * TopicTransport node = new BrokerTransport("listener", broker);
 * node.subscribe("chatter", StringMessage.class, handler);
 * while (running) {
 *     node.pumpOnce(Duration.ofMillis(100));
 * }
 * node.close();
 * }</pre>
 */
public class BrokerTransport implements TopicTransport {

    private static final Logger logger = LoggerFactory.getLogger(BrokerTransport.class);

    private final String name;
    private final MessageBroker<Object> broker;
    private final Map<Subscription, Bridge<?>> active = new ConcurrentHashMap<>();
    private final BlockingQueue<Delivery> pending = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public BrokerTransport(String name, MessageBroker<Object> broker) {
        if (name == null) {
            throw new IllegalArgumentException("Name cannot be null");
        }
        if (broker == null) {
            throw new IllegalArgumentException("Broker cannot be null");
        }
        this.name = name;
        this.broker = broker;
    }

    /**
     * @return a factory creating one node per caller on the given broker
     */
    public static TransportFactory factory(MessageBroker<Object> broker) {
        return name -> new BrokerTransport(name, broker);
    }

    @Override
    public <T> Subscription subscribe(String topic, Class<T> messageType, MessageSubscriber<T> handler) {
        if (topic == null || messageType == null || handler == null) {
            throw new IllegalArgumentException("Topic, message type and handler are required");
        }
        if (closed.get()) {
            throw new TransportException("Transport " + name + " is closed");
        }

        var subscription = new Subscription(UUID.randomUUID().toString(), topic, messageType);
        var bridge = new Bridge<>(subscription, messageType, handler);
        active.put(subscription, bridge);
        try {
            broker.subscribe(topic, bridge);
        } catch (RuntimeException e) {
            active.remove(subscription);
            throw new TransportException("Failed to subscribe " + name + " to " + topic, e);
        }

        logger.atDebug()
                .addArgument(name)
                .addArgument(topic)
                .addArgument(messageType.getSimpleName())
                .log("{} subscribed to {} ({})");
        return subscription;
    }

    @Override
    public boolean unsubscribe(Subscription subscription) {
        if (subscription == null) {
            throw new IllegalArgumentException("Subscription cannot be null");
        }
        Bridge<?> bridge = active.remove(subscription);
        if (bridge == null) {
            return false;
        }
        broker.unsubscribe(subscription.topic(), bridge);
        logger.atDebug()
                .addArgument(name)
                .addArgument(subscription.topic())
                .log("{} unsubscribed from {}");
        return true;
    }

    @Override
    public boolean pumpOnce(Duration pollInterval) throws InterruptedException {
        if (closed.get()) {
            return false;
        }
        Delivery first = pending.poll(pollInterval.toNanos(), TimeUnit.NANOSECONDS);
        if (first == null) {
            return false;
        }
        List<Delivery> batch = new ArrayList<>();
        batch.add(first);
        pending.drainTo(batch);
        boolean delivered = false;
        for (Delivery delivery : batch) {
            if (closed.get()) {
                break;
            }
            delivered |= delivery.bridge().deliver(delivery.message());
        }
        return delivered;
    }

    /**
     * @return number of messages queued and not yet pumped
     */
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Subscription subscription : List.copyOf(active.keySet())) {
            try {
                unsubscribe(subscription);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(subscription.topic())
                        .setCause(e)
                        .log("Error unsubscribing from {}");
            }
        }
        pending.clear();
        logger.atDebug().addArgument(name).log("Transport {} closed");
    }

    private record Delivery(Bridge<?> bridge, Object message) {
    }

    private class Bridge<T> implements MessageSubscriber<Object> {
        private final Subscription subscription;
        private final Class<T> messageType;
        private final MessageSubscriber<T> handler;

        Bridge(Subscription subscription, Class<T> messageType, MessageSubscriber<T> handler) {
            this.subscription = subscription;
            this.messageType = messageType;
            this.handler = handler;
        }

        @Override
        public void onMessage(Object message) {
            if (!closed.get()) {
                pending.offer(new Delivery(this, message));
            }
        }

        @Override
        public void onError(Throwable error) {
            handler.onError(error);
        }

        boolean deliver(Object message) {
            if (!active.containsKey(subscription)) {
                return false;
            }
            if (!messageType.isInstance(message)) {
                handler.onError(new ClassCastException("Message on " + subscription.topic() + " is a "
                        + message.getClass().getName() + ", expected " + messageType.getName()));
                return true;
            }
            try {
                handler.onMessage(messageType.cast(message));
            } catch (RuntimeException e) {
                logger.atWarn()
                        .addArgument(subscription.topic())
                        .setCause(e)
                        .log("Handler failed for message on {}");
                handler.onError(e);
            }
            return true;
        }
    }
}
