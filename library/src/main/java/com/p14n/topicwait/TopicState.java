package com.p14n.topicwait;

import java.util.Queue;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.Queues;
import com.p14n.topicwait.data.TopicSpec;
import com.p14n.topicwait.transport.Subscription;

/**
 * Per-topic bookkeeping of a waiter. {@code received} is guarded by the
 * owning waiter's lock; the buffer synchronises on itself.
 */
final class TopicState {

    private final TopicSpec spec;
    private final String resolvedName;
    private final Queue<Object> buffer;
    private boolean received;
    private Subscription subscription;

    TopicState(TopicSpec spec, String resolvedName, int bufferLength) {
        this.spec = spec;
        this.resolvedName = resolvedName;
        this.buffer = Queues.synchronizedQueue(EvictingQueue.create(bufferLength));
    }

    String name() {
        return spec.topicName();
    }

    String resolvedName() {
        return resolvedName;
    }

    Class<?> messageType() {
        return spec.messageType();
    }

    Queue<Object> buffer() {
        return buffer;
    }

    boolean received() {
        return received;
    }

    /**
     * Appends a message, evicting the oldest when full.
     *
     * @return true if this was the first message ever seen on the topic
     */
    boolean append(Object message) {
        buffer.add(message);
        if (received) {
            return false;
        }
        received = true;
        return true;
    }

    Subscription subscription() {
        return subscription;
    }

    void subscription(Subscription subscription) {
        this.subscription = subscription;
    }
}
