package com.p14n.topicwait;

import java.time.Duration;
import java.util.Set;

/**
 * Raised when opening a {@link TopicWaiterSession} times out before every
 * topic produced a message.
 */
public class TopicsNotReceivedException extends RuntimeException {

    private final Set<String> notReceived;
    private final Duration timeout;

    public TopicsNotReceivedException(Set<String> notReceived, Duration timeout) {
        super("Topics not received within " + timeout + ": " + notReceived);
        this.notReceived = Set.copyOf(notReceived);
        this.timeout = timeout;
    }

    public Set<String> notReceived() {
        return notReceived;
    }

    public Duration timeout() {
        return timeout;
    }
}
