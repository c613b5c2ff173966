package com.p14n.topicwait.transport;

/**
 * Creates a fresh transport node for each waiter so that independent waiters
 * never share subscriptions or pending queues.
 */
@FunctionalInterface
public interface TransportFactory {

    TopicTransport create(String name);
}
