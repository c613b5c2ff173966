package com.p14n.topicwait.data;

/**
 * A topic to wait on together with the type its messages carry.
 */
public record TopicSpec(String topicName, Class<?> messageType) {

    public TopicSpec {
        if (topicName == null || topicName.trim().isEmpty()) {
            throw new IllegalArgumentException("topicName cannot be null or empty");
        }
        if (messageType == null) {
            throw new IllegalArgumentException("messageType cannot be null");
        }
    }

    public static TopicSpec of(String topicName, Class<?> messageType) {
        return new TopicSpec(topicName, messageType);
    }
}
