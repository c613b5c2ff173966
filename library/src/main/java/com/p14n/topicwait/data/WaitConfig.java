package com.p14n.topicwait.data;

import java.time.Duration;
import java.util.List;

/**
 * Settings for a single topic wait.
 */
public interface WaitConfig {

    /**
     * @return the topics to wait on, in order
     */
    List<TopicSpec> topics();

    /**
     * Wall-clock limit measured from the start of the wait.
     *
     * @return the wait timeout
     */
    Duration timeout();

    /**
     * Number of most recent messages kept per topic. Default is 1.
     *
     * @return the buffer length
     */
    default int bufferLength() {
        return 1;
    }

    /**
     * Interval at which the wait re-checks its exit conditions, invokes the
     * callback and at which the pump observes cancellation.
     * Default is 100 milliseconds.
     *
     * @return the poll interval
     */
    default Duration pollInterval() {
        return Duration.ofMillis(100);
    }

    /**
     * Prefix applied to relative topic names. Empty means none.
     *
     * @return the namespace
     */
    default String namespace() {
        return "";
    }

    /**
     * Name used for the transport node, thread names and log output.
     *
     * @return the waiter name
     */
    default String name() {
        return "topic_waiter";
    }

    /**
     * Resolves a topic name against {@link #namespace()}. Names starting with
     * {@code /} are absolute and returned unchanged.
     *
     * @param topicName topic name as given
     * @return the name to subscribe to
     */
    default String resolve(String topicName) {
        String ns = namespace();
        if (ns == null || ns.isEmpty() || topicName.startsWith("/")) {
            return topicName;
        }
        return ns.endsWith("/") ? ns + topicName : ns + "/" + topicName;
    }
}
