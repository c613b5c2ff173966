package com.p14n.topicwait.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for broker traffic, all keyed by topic.
 *
 * <ul>
 * <li>messages_published: messages accepted for a topic with at least one
 * subscriber</li>
 * <li>messages_received: successful hand-offs to subscribers</li>
 * <li>active_subscribers: current subscriber count</li>
 * </ul>
 */
public class BrokerMetrics {
        static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final LongCounter publishedMessages;
        private final LongCounter receivedMessages;
        private final LongUpDownCounter activeSubscribers;

        /**
         * Creates the instruments on the given meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages received by subscribers")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        /**
         * Records a message published to a topic that had subscribers.
         *
         * @param topic The topic the message was published to
         */
        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        /**
         * Records a successful hand-off to one subscriber.
         *
         * @param topic The topic the message was received from
         */
        public void recordReceived(String topic) {
                receivedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        /**
         * Increments the active subscriber count for a topic.
         *
         * @param topic The topic the subscriber was added to
         */
        public void recordSubscriberAdded(String topic) {
                activeSubscribers.add(1, Attributes.of(TOPIC, topic));
        }

        /**
         * Decrements the active subscriber count for a topic.
         *
         * @param topic The topic the subscriber was removed from
         */
        public void recordSubscriberRemoved(String topic) {
                activeSubscribers.add(-1, Attributes.of(TOPIC, topic));
        }
}
