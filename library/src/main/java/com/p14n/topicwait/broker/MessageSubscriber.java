package com.p14n.topicwait.broker;

/**
 * Interface for message subscribers that can receive messages and error
 * notifications.
 *
 * @param <T> The type of messages this subscriber handles
 */
public interface MessageSubscriber<T> {

    /**
     * Called when a new message is available for processing.
     *
     * @param message The message to process
     */
    void onMessage(T message);

    /**
     * Called when a message could not be handed to {@link #onMessage} or
     * {@link #onMessage} itself failed.
     *
     * @param error The error that occurred
     */
    void onError(Throwable error);
}
