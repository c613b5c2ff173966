package com.p14n.topicwait;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Try-with-resources form of a {@link TopicWaiter}. Opening waits for every
 * topic and fails if any is missing; closing always shuts the waiter down.
 *
 * <pre>{@code
 * try (var session = TopicWaiterSession.open(waiter)) {
 *     assertEquals(expected, session.topicsReceived());
 * }
 * }</pre>
 */
public final class TopicWaiterSession implements AutoCloseable {

    private final TopicWaiter waiter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private TopicWaiterSession(TopicWaiter waiter) {
        this.waiter = waiter;
    }

    /**
     * Starts the waiter and waits for all of its topics.
     *
     * @throws TopicsNotReceivedException if the timeout elapses first; the waiter
     *                                    has been shut down when this is thrown
     */
    public static TopicWaiterSession open(TopicWaiter waiter) {
        return open(waiter, null);
    }

    /**
     * Same as {@link #open(TopicWaiter)}, passing {@code argument} to the
     * waiter's callback.
     */
    public static TopicWaiterSession open(TopicWaiter waiter, Object argument) {
        if (waiter == null) {
            throw new IllegalArgumentException("Waiter cannot be null");
        }
        boolean satisfied;
        try {
            satisfied = waiter.await(argument);
        } catch (RuntimeException e) {
            waiter.shutdown();
            throw e;
        }
        if (!satisfied) {
            Set<String> notReceived = waiter.topicsNotReceived();
            waiter.shutdown();
            throw new TopicsNotReceivedException(notReceived, waiter.timeout());
        }
        return new TopicWaiterSession(waiter);
    }

    public TopicWaiter waiter() {
        return waiter;
    }

    public Set<String> topicsReceived() {
        return waiter.topicsReceived();
    }

    public Set<String> topicsNotReceived() {
        return waiter.topicsNotReceived();
    }

    public Queue<Object> receivedMessages(String topicName) {
        return waiter.receivedMessages(topicName);
    }

    public <T> Queue<T> receivedMessages(String topicName, Class<T> type) {
        return waiter.receivedMessages(topicName, type);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            waiter.shutdown();
        }
    }
}
