package com.p14n.topicwait;

/**
 * Raised when a buffer is requested for a topic the waiter was not created
 * with.
 */
public class UnknownTopicException extends IllegalArgumentException {

    private final String topic;

    public UnknownTopicException(String topic) {
        super("Topic " + topic + " is not one of the awaited topics");
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
