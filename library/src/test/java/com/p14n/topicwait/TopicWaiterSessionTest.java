package com.p14n.topicwait;

import com.p14n.topicwait.broker.DefaultMessageBroker;
import com.p14n.topicwait.data.StringMessage;
import com.p14n.topicwait.data.TopicSpec;
import com.p14n.topicwait.example.Talker;
import com.p14n.topicwait.transport.BrokerTransport;
import com.p14n.topicwait.transport.TransportFactory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 20, unit = TimeUnit.SECONDS)
class TopicWaiterSessionTest {

    private static final Pattern MESSAGE_PATTERN = Pattern.compile("Hello World: \\d+");
    private static final List<TopicSpec> TOPICS = List.of(
            TopicSpec.of("chatter_0", StringMessage.class),
            TopicSpec.of("chatter_1", StringMessage.class));

    private DefaultMessageBroker<Object> broker;
    private TransportFactory transports;
    private final List<Talker> talkers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        broker = new DefaultMessageBroker<>();
        transports = BrokerTransport.factory(broker);
        talkers.add(Talker.start(broker, "chatter_0", Duration.ofMillis(100)));
        talkers.add(Talker.start(broker, "chatter_1", Duration.ofMillis(100)));
    }

    @AfterEach
    void tearDown() {
        talkers.forEach(Talker::close);
        broker.close();
    }

    @Test
    void shouldExposeMessagesInsideAndShutDownAfter() {
        var waiter = new TopicWaiter(TOPICS, Duration.ofSeconds(10), 10, transports);

        try (var session = TopicWaiterSession.open(waiter)) {
            assertEquals(Set.of("chatter_0", "chatter_1"), session.topicsReceived());
            assertEquals(Set.of(), session.topicsNotReceived());
            for (TopicSpec topic : TOPICS) {
                var messages = session.receivedMessages(topic.topicName(), StringMessage.class);
                assertFalse(messages.isEmpty());
                assertTrue(MESSAGE_PATTERN.matcher(messages.poll().data()).matches());
            }
            assertSame(waiter, session.waiter());
            assertEquals(WaiterState.SATISFIED, waiter.state());
        }

        assertEquals(WaiterState.SHUTDOWN, waiter.state());
    }

    @Test
    void shouldShutDownWhenBodyThrows() {
        var waiter = new TopicWaiter(TOPICS, Duration.ofSeconds(10), transports);

        assertThrows(IllegalStateException.class, () -> {
            try (var session = TopicWaiterSession.open(waiter)) {
                throw new IllegalStateException("body failed");
            }
        });

        assertEquals(WaiterState.SHUTDOWN, waiter.state());
    }

    @Test
    void shouldFailToOpenWhenTopicMissing() {
        var topics = new ArrayList<>(TOPICS);
        topics.add(TopicSpec.of("invalid_topic", StringMessage.class));
        var waiter = new TopicWaiter(topics, Duration.ofSeconds(2), transports);
        AtomicBoolean bodyRan = new AtomicBoolean(false);

        var e = assertThrows(TopicsNotReceivedException.class, () -> {
            try (var session = TopicWaiterSession.open(waiter)) {
                bodyRan.set(true);
            }
        });

        assertFalse(bodyRan.get());
        assertEquals(Set.of("invalid_topic"), e.notReceived());
        assertEquals(Duration.ofSeconds(2), e.timeout());
        assertEquals(WaiterState.SHUTDOWN, waiter.state());
    }

    @Test
    void shouldPassArgumentToCallback() {
        AtomicReference<Object> seen = new AtomicReference<>();
        var waiter = new TopicWaiter(TOPICS, Duration.ofSeconds(10), transports,
                (context, arg) -> seen.set(arg));

        try (var session = TopicWaiterSession.open(waiter, "marker")) {
            assertEquals("marker", seen.get());
        }
    }

    @Test
    void shouldCloseOnlyOnce() {
        var waiter = new TopicWaiter(TOPICS, Duration.ofSeconds(10), transports);

        var session = TopicWaiterSession.open(waiter);
        session.close();
        session.close();

        assertEquals(WaiterState.SHUTDOWN, waiter.state());
    }

    @Test
    void shouldRejectAlreadyStartedWaiter() {
        var waiter = new TopicWaiter(TOPICS, Duration.ofSeconds(10), transports);
        assertTrue(waiter.start());

        assertThrows(IllegalStateException.class, () -> TopicWaiterSession.open(waiter));
        assertEquals(WaiterState.SHUTDOWN, waiter.state());
    }
}
