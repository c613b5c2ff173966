package com.p14n.topicwait;

import java.time.Duration;
import java.util.Set;

import org.slf4j.Logger;

/**
 * Read-only view of a running wait, handed to triggers and callbacks.
 */
public interface WaitContext {

    String name();

    Set<String> topicsReceived();

    Set<String> topicsNotReceived();

    /**
     * @return time since the wait started
     */
    Duration elapsed();

    Logger logger();
}
