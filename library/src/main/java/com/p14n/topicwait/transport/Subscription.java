package com.p14n.topicwait.transport;

/**
 * Handle for a live registration on a {@link TopicTransport}.
 */
public record Subscription(String id, String topic, Class<?> messageType) {
}
