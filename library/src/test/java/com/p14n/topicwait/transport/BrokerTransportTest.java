package com.p14n.topicwait.transport;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.p14n.topicwait.broker.DefaultMessageBroker;
import com.p14n.topicwait.broker.MessageSubscriber;
import com.p14n.topicwait.data.StringMessage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class BrokerTransportTest {

    private static final Duration POLL = Duration.ofMillis(50);

    private DefaultMessageBroker<Object> broker;
    private BrokerTransport transport;

    @BeforeEach
    void setUp() {
        broker = new DefaultMessageBroker<>();
        transport = new BrokerTransport("test_node", broker);
    }

    @AfterEach
    void tearDown() {
        transport.close();
        broker.close();
    }

    private static class Collecting<T> implements MessageSubscriber<T> {
        final List<T> messages = new CopyOnWriteArrayList<>();
        final AtomicReference<Throwable> error = new AtomicReference<>();

        @Override
        public void onMessage(T message) {
            messages.add(message);
        }

        @Override
        public void onError(Throwable error) {
            this.error.set(error);
        }
    }

    @Test
    void shouldOnlyDeliverWhenPumped() throws InterruptedException {
        var handler = new Collecting<StringMessage>();
        transport.subscribe("chatter", StringMessage.class, handler);

        broker.publish("chatter", new StringMessage("one"));
        broker.publish("chatter", new StringMessage("two"));

        assertTrue(handler.messages.isEmpty());
        assertEquals(2, transport.pendingCount());

        assertTrue(transport.pumpOnce(POLL));
        assertEquals(List.of(new StringMessage("one"), new StringMessage("two")), handler.messages);
        assertEquals(0, transport.pendingCount());
    }

    @Test
    void shouldReturnFalseWhenNothingArrivesWithinPollInterval() throws InterruptedException {
        transport.subscribe("chatter", StringMessage.class, new Collecting<>());

        long start = System.nanoTime();
        assertFalse(transport.pumpOnce(POLL));
        assertTrue(System.nanoTime() - start >= POLL.toNanos() / 2);
    }

    @Test
    void shouldWakeUpWhenMessageArrivesDuringPoll() throws InterruptedException {
        var handler = new Collecting<StringMessage>();
        transport.subscribe("chatter", StringMessage.class, handler);

        var publisher = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            broker.publish("chatter", new StringMessage("late"));
        });
        publisher.start();

        assertTrue(transport.pumpOnce(Duration.ofSeconds(2)));
        assertEquals(List.of(new StringMessage("late")), handler.messages);
        publisher.join();
    }

    @Test
    void shouldReportWrongMessageTypeToHandler() throws InterruptedException {
        var handler = new Collecting<StringMessage>();
        transport.subscribe("chatter", StringMessage.class, handler);

        broker.publish("chatter", 42);

        assertTrue(transport.pumpOnce(POLL));
        assertTrue(handler.messages.isEmpty());
        assertInstanceOf(ClassCastException.class, handler.error.get());
    }

    @Test
    void shouldReportHandlerFailureToHandler() throws InterruptedException {
        var failure = new RuntimeException("boom");
        AtomicReference<Throwable> seen = new AtomicReference<>();
        transport.subscribe("chatter", StringMessage.class, new MessageSubscriber<>() {
            @Override
            public void onMessage(StringMessage message) {
                throw failure;
            }

            @Override
            public void onError(Throwable error) {
                seen.set(error);
            }
        });

        broker.publish("chatter", new StringMessage("x"));

        assertTrue(transport.pumpOnce(POLL));
        assertSame(failure, seen.get());
    }

    @Test
    void shouldDiscardPendingDeliveriesAfterUnsubscribe() throws InterruptedException {
        var handler = new Collecting<StringMessage>();
        Subscription subscription = transport.subscribe("chatter", StringMessage.class, handler);

        broker.publish("chatter", new StringMessage("queued"));
        assertTrue(transport.unsubscribe(subscription));
        assertFalse(transport.unsubscribe(subscription));
        broker.publish("chatter", new StringMessage("after"));

        assertFalse(transport.pumpOnce(POLL));
        assertTrue(handler.messages.isEmpty());
    }

    @Test
    void shouldGiveEachNodeItsOwnCopy() throws InterruptedException {
        var other = new BrokerTransport("other_node", broker);
        try {
            var mine = new Collecting<StringMessage>();
            var theirs = new Collecting<StringMessage>();
            transport.subscribe("chatter", StringMessage.class, mine);
            other.subscribe("chatter", StringMessage.class, theirs);

            broker.publish("chatter", new StringMessage("shared"));

            assertTrue(transport.pumpOnce(POLL));
            assertEquals(1, mine.messages.size());
            assertTrue(theirs.messages.isEmpty());

            assertTrue(other.pumpOnce(POLL));
            assertEquals(1, theirs.messages.size());
        } finally {
            other.close();
        }
    }

    @Test
    void shouldFailToSubscribeWhenClosed() {
        transport.close();
        transport.close();
        assertThrows(TransportException.class,
                () -> transport.subscribe("chatter", StringMessage.class, new Collecting<>()));
    }

    @Test
    void shouldWrapBrokerRefusalInTransportException() {
        broker.close();
        var e = assertThrows(TransportException.class,
                () -> transport.subscribe("chatter", StringMessage.class, new Collecting<>()));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void shouldStopReceivingAfterClose() throws InterruptedException {
        var handler = new Collecting<StringMessage>();
        transport.subscribe("chatter", StringMessage.class, handler);
        broker.publish("chatter", new StringMessage("before"));

        transport.close();
        broker.publish("chatter", new StringMessage("after"));

        assertEquals(0, transport.pendingCount());
        assertFalse(transport.pumpOnce(POLL));
        assertTrue(handler.messages.isEmpty());
    }

    @Test
    void factoryShouldCreateIndependentNodes() {
        TransportFactory factory = BrokerTransport.factory(broker);
        TopicTransport first = factory.create("a");
        TopicTransport second = factory.create("b");
        try {
            assertNotSame(first, second);
        } finally {
            first.close();
            second.close();
        }
    }
}
