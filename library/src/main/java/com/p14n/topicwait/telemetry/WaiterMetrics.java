package com.p14n.topicwait.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Instruments recorded by a topic waiter.
 *
 * <ul>
 * <li>waits_completed: finished waits, tagged with the waiter name and
 * {@code outcome} ({@code satisfied} or {@code timed_out})</li>
 * <li>messages_buffered: messages appended to a topic buffer</li>
 * </ul>
 */
public class WaiterMetrics {
        private static final AttributeKey<String> WAITER = AttributeKey.stringKey("waiter");
        private static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");

        private final LongCounter waitsCompleted;
        private final LongCounter messagesBuffered;
        private final String waiterName;

        /**
         * @param meter      OpenTelemetry meter used to create the instruments
         * @param waiterName Value of the {@code waiter} attribute on every measurement
         */
        public WaiterMetrics(Meter meter, String waiterName) {
                this.waiterName = waiterName;
                waitsCompleted = meter.counterBuilder("waits_completed")
                                .setDescription("Number of topic waits that finished")
                                .build();
                messagesBuffered = meter.counterBuilder("messages_buffered")
                                .setDescription("Number of messages appended to topic buffers")
                                .build();
        }

        /**
         * Records the end of a wait.
         *
         * @param satisfied true if every topic was received before the timeout
         */
        public void recordWaitCompleted(boolean satisfied) {
                waitsCompleted.add(1, Attributes.of(
                                WAITER, waiterName,
                                OUTCOME, satisfied ? "satisfied" : "timed_out"));
        }

        /**
         * @param topic Resolved name of the topic whose buffer took the message
         */
        public void recordBuffered(String topic) {
                messagesBuffered.add(1, Attributes.of(
                                WAITER, waiterName,
                                BrokerMetrics.TOPIC, topic));
        }
}
