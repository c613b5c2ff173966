package com.p14n.topicwait.data;

/**
 * Plain text message.
 */
public record StringMessage(String data) {
}
