package com.p14n.topicwait;

/**
 * Lifecycle of a {@link TopicWaiter}. {@code SHUTDOWN} is terminal.
 */
public enum WaiterState {
    IDLE,
    STARTED,
    SATISFIED,
    TIMED_OUT,
    SHUTDOWN
}
