package com.p14n.topicwait.data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Splitter;

public record WaitConfigData(List<TopicSpec> topics,
        Duration timeout,
        int bufferLength,
        Duration pollInterval,
        String namespace,
        String name) implements WaitConfig {

    public static final String TOPICS = "topicwait.topics";
    public static final String TIMEOUT_MS = "topicwait.timeout.ms";
    public static final String BUFFER_LENGTH = "topicwait.buffer.length";
    public static final String POLL_INTERVAL_MS = "topicwait.poll.interval.ms";
    public static final String NAMESPACE = "topicwait.namespace";
    public static final String NAME = "topicwait.name";

    public WaitConfigData {
        topics = topics == null ? null : List.copyOf(topics);
    }

    public WaitConfigData(List<TopicSpec> topics, Duration timeout, int bufferLength) {
        this(topics, timeout, bufferLength, Duration.ofMillis(100), "", "topic_waiter");
    }

    public WaitConfigData(List<TopicSpec> topics, Duration timeout) {
        this(topics, timeout, 1);
    }

    /**
     * Reads a configuration from properties.
     * {@value #TOPICS} holds comma separated {@code name=fully.qualified.Type}
     * entries.
     *
     * @throws IllegalArgumentException if a required key is missing or a value
     *                                  cannot be parsed
     */
    public static WaitConfigData fromProperties(Properties props) {
        List<TopicSpec> topics = new ArrayList<>();
        for (String entry : Splitter.on(',').trimResults().omitEmptyStrings().split(required(props, TOPICS))) {
            List<String> parts = Splitter.on('=').trimResults().splitToList(entry);
            if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
                throw new IllegalArgumentException(TOPICS + " entry '" + entry + "' is not name=type");
            }
            topics.add(new TopicSpec(parts.get(0), loadClass(parts.get(1))));
        }
        return new WaitConfigData(topics,
                Duration.ofMillis(parseLong(TIMEOUT_MS, required(props, TIMEOUT_MS))),
                parseInt(BUFFER_LENGTH, props.getProperty(BUFFER_LENGTH, "1")),
                Duration.ofMillis(parseLong(POLL_INTERVAL_MS, props.getProperty(POLL_INTERVAL_MS, "100"))),
                props.getProperty(NAMESPACE, ""),
                props.getProperty(NAME, "topic_waiter"));
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value.trim();
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number but was '" + value + "'", e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number up to "
                    + Integer.MAX_VALUE + " but was '" + value + "'", e);
        }
    }

    private static Class<?> loadClass(String className) {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException(TOPICS + " refers to unknown type " + className, e);
        }
    }
}
