package com.p14n.topicwait.transport;

/**
 * Raised when the transport refuses or fails to create a subscription, or
 * fails while delivering messages.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
