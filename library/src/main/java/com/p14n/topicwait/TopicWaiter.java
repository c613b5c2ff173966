package com.p14n.topicwait;

import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableSet;
import com.p14n.topicwait.broker.AsyncExecutor;
import com.p14n.topicwait.broker.DefaultExecutor;
import com.p14n.topicwait.broker.MessageSubscriber;
import com.p14n.topicwait.data.TopicSpec;
import com.p14n.topicwait.data.WaitConfig;
import com.p14n.topicwait.data.WaitConfigData;
import com.p14n.topicwait.telemetry.WaiterMetrics;
import com.p14n.topicwait.transport.Subscription;
import com.p14n.topicwait.transport.TopicTransport;
import com.p14n.topicwait.transport.TransportException;
import com.p14n.topicwait.transport.TransportFactory;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.topicwait.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Blocks until each of a set of topics has produced at least one message, or
 * a timeout elapses, keeping the most recent messages of every topic for
 * inspection.
 *
 * <p>
 * Starting the waiter creates a dedicated transport node, subscribes to every
 * topic and pumps the node on a thread of its own. The calling thread polls
 * for completion and, when configured, runs the callback once per poll tick.
 * Independent waiters share nothing and can run side by side.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var waiter = new TopicWaiter(
 *         List.of(TopicSpec.of("chatter", StringMessage.class)),
 *         Duration.ofSeconds(10),
 *         BrokerTransport.factory(broker));
 * try {
 *     if (waiter.await()) {
 *         var latest = waiter.receivedMessages("chatter", StringMessage.class).poll();
 *     }
 * } finally {
 *     waiter.shutdown();
 * }
 * }</pre>
 *
 * <p>
 * {@link TopicWaiterSession} wraps the same lifecycle for try-with-resources.
 * </p>
 */
public class TopicWaiter {

    private static final Logger logger = LoggerFactory.getLogger(TopicWaiter.class);

    private final WaitConfig cfg;
    private final TransportFactory transportFactory;
    private final BiConsumer<WaitContext, Object> callback;
    private final Consumer<WaitContext> trigger;
    private final Tracer tracer;
    private final WaiterMetrics metrics;
    private final Map<String, TopicState> topics = new LinkedHashMap<>();
    private final WaitContext context = new View();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition allReceived = lock.newCondition();
    private final Object lifecycle = new Object();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicReference<RuntimeException> pumpFailure = new AtomicReference<>();

    // guarded by lock
    private WaiterState state = WaiterState.IDLE;
    private int receivedCount;
    private long startedAt;

    // guarded by lifecycle
    private TopicTransport transport;
    private AsyncExecutor executor;
    private Future<?> pump;

    public TopicWaiter(List<TopicSpec> topics, Duration timeout, TransportFactory transportFactory) {
        this(new WaitConfigData(topics, timeout), transportFactory);
    }

    public TopicWaiter(List<TopicSpec> topics, Duration timeout, int bufferLength,
            TransportFactory transportFactory) {
        this(new WaitConfigData(topics, timeout, bufferLength), transportFactory);
    }

    public TopicWaiter(List<TopicSpec> topics, Duration timeout, TransportFactory transportFactory,
            BiConsumer<WaitContext, Object> callback) {
        this(new WaitConfigData(topics, timeout), transportFactory, OpenTelemetry.noop(), callback, null);
    }

    public TopicWaiter(WaitConfig cfg, TransportFactory transportFactory) {
        this(cfg, transportFactory, OpenTelemetry.noop(), null, null);
    }

    /**
     * Creates a waiter. Arguments are validated here; nothing is subscribed
     * until {@link #start()}.
     *
     * @param cfg              topics, timeout, buffer length and poll settings
     * @param transportFactory creates the transport node this waiter owns
     * @param ot               OpenTelemetry instance for spans and metrics
     * @param callback         invoked on every poll tick with the argument given
     *                         to {@link #await(Object)}, may be null
     * @param trigger          invoked once after all subscriptions are in place,
     *                         may be null
     * @throws IllegalArgumentException if the configuration is invalid or names a
     *                                  topic twice
     */
    public TopicWaiter(WaitConfig cfg, TransportFactory transportFactory, OpenTelemetry ot,
            BiConsumer<WaitContext, Object> callback, Consumer<WaitContext> trigger) {
        if (cfg == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        if (transportFactory == null) {
            throw new IllegalArgumentException("Transport factory cannot be null");
        }
        if (ot == null) {
            throw new IllegalArgumentException("OpenTelemetry cannot be null");
        }
        validate(cfg);

        this.cfg = cfg;
        this.transportFactory = transportFactory;
        this.callback = callback;
        this.trigger = trigger;
        this.tracer = ot.getTracer("topic_waiter");
        this.metrics = new WaiterMetrics(ot.getMeter("topic_waiter"), cfg.name());

        Set<String> resolved = new HashSet<>();
        for (TopicSpec spec : cfg.topics()) {
            if (spec == null) {
                throw new IllegalArgumentException("Topic list cannot contain null");
            }
            String resolvedName = cfg.resolve(spec.topicName());
            if (this.topics.containsKey(spec.topicName()) || !resolved.add(resolvedName)) {
                throw new IllegalArgumentException("Topic " + spec.topicName() + " is listed more than once");
            }
            this.topics.put(spec.topicName(), new TopicState(spec, resolvedName, cfg.bufferLength()));
        }
    }

    private static void validate(WaitConfig cfg) {
        if (cfg.topics() == null || cfg.topics().isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        if (cfg.timeout() == null || cfg.timeout().isNegative() || cfg.timeout().isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        if (cfg.bufferLength() < 1) {
            throw new IllegalArgumentException("Buffer length must be at least 1");
        }
        if (cfg.pollInterval() == null || cfg.pollInterval().isNegative() || cfg.pollInterval().isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (cfg.name() == null || cfg.name().isBlank()) {
            throw new IllegalArgumentException("Name cannot be empty");
        }
    }

    /**
     * Subscribes to every topic and blocks until all of them have produced a
     * message or the timeout elapses.
     *
     * @return true if every topic was received, false on timeout
     * @throws IllegalStateException if the waiter was already started or shut
     *                               down
     * @throws TransportException  if a subscription fails or the transport
     *                               stops delivering; the waiter is shut down
     *                               first
     */
    public boolean start() {
        return await(null);
    }

    /**
     * Same as {@link #start()}.
     */
    public boolean await() {
        return await(null);
    }

    /**
     * Same as {@link #start()}, passing {@code argument} to the callback on
     * every poll tick.
     */
    public boolean await(Object argument) {
        lock.lock();
        try {
            if (state != WaiterState.IDLE) {
                throw new IllegalStateException("Topic waiter " + cfg.name() + " is " + state
                        + ", it can only be started once");
            }
            state = WaiterState.STARTED;
            startedAt = System.nanoTime();
        } finally {
            lock.unlock();
        }

        logger.atInfo()
                .addArgument(cfg.name())
                .addArgument(topics::keySet)
                .addArgument(cfg.timeout())
                .log("Waiter {} waiting for topics {} (timeout {})");

        return processWithTelemetry(tracer, "await_topics",
                Attributes.of(AttributeKey.stringKey("waiter"), cfg.name(),
                        AttributeKey.longKey("topics"), (long) topics.size()),
                () -> {
                    try {
                        open();
                        if (trigger != null) {
                            trigger.accept(context);
                        }
                        boolean satisfied = poll(argument);
                        metrics.recordWaitCompleted(satisfied);
                        return satisfied;
                    } catch (RuntimeException e) {
                        logger.atError()
                                .addArgument(cfg.name())
                                .setCause(e)
                                .log("Waiter {} failed, shutting down");
                        shutdown();
                        throw e;
                    }
                });
    }

    private void open() {
        synchronized (lifecycle) {
            if (currentState() != WaiterState.STARTED) {
                return;
            }
            transport = transportFactory.create(cfg.name());
            for (TopicState topic : topics.values()) {
                topic.subscription(subscribe(topic, topic.messageType()));
            }
            executor = new DefaultExecutor(cfg.name() + "-pump", 1, 1);
            pump = executor.submit(this::pump);
        }
    }

    private <T> Subscription subscribe(TopicState topic, Class<T> messageType) {
        return transport.subscribe(topic.resolvedName(), messageType, new MessageSubscriber<T>() {
            @Override
            public void onMessage(T message) {
                buffer(topic, message);
            }

            @Override
            public void onError(Throwable error) {
                logger.atWarn()
                        .addArgument(topic.name())
                        .addArgument(cfg.name())
                        .setCause(error)
                        .log("Dropped message on {} for waiter {}");
            }
        });
    }

    private Void pump() throws InterruptedException {
        logger.atDebug().addArgument(cfg.name()).log("Pump for {} started");
        try {
            while (!cancelled.get()) {
                transport.pumpOnce(cfg.pollInterval());
            }
        } catch (RuntimeException e) {
            pumpFailure.set(e);
            lock.lock();
            try {
                allReceived.signalAll();
            } finally {
                lock.unlock();
            }
            throw e;
        }
        logger.atDebug().addArgument(cfg.name()).log("Pump for {} stopped");
        return null;
    }

    private void buffer(TopicState topic, Object message) {
        lock.lock();
        try {
            if (state == WaiterState.SHUTDOWN) {
                return;
            }
            if (topic.append(message)) {
                receivedCount++;
                logger.atDebug()
                        .addArgument(topic.name())
                        .addArgument(cfg.name())
                        .log("First message on {} for waiter {}");
                if (receivedCount == topics.size()) {
                    allReceived.signalAll();
                }
            }
        } finally {
            lock.unlock();
        }
        metrics.recordBuffered(topic.name());
    }

    private boolean poll(Object argument) {
        long deadline = startedAt + cfg.timeout().toNanos();
        long interval = cfg.pollInterval().toNanos();
        while (true) {
            if (callback != null) {
                callback.accept(context, argument);
            }
            lock.lock();
            try {
                if (state == WaiterState.SHUTDOWN) {
                    return false;
                }
                if (receivedCount == topics.size()) {
                    state = WaiterState.SATISFIED;
                    logger.atInfo()
                            .addArgument(cfg.name())
                            .addArgument(() -> Duration.ofNanos(System.nanoTime() - startedAt))
                            .log("Waiter {} received all topics after {}");
                    return true;
                }
                RuntimeException failure = pumpFailure.get();
                if (failure != null) {
                    throw new TransportException("Transport for waiter " + cfg.name() + " stopped pumping", failure);
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    state = WaiterState.TIMED_OUT;
                    logger.atInfo()
                            .addArgument(cfg.name())
                            .addArgument(this::notReceivedLocked)
                            .log("Waiter {} timed out, not received: {}");
                    return false;
                }
                allReceived.awaitNanos(Math.min(remaining, interval));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state = WaiterState.TIMED_OUT;
                logger.atWarn().addArgument(cfg.name()).log("Waiter {} interrupted");
                return false;
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Stops the pump, cancels every subscription and releases the transport.
     * Safe to call repeatedly and before {@link #start()}. Buffers and the
     * received/not-received classification stay readable afterwards but no
     * longer change.
     */
    public void shutdown() {
        WaiterState previous;
        lock.lock();
        try {
            previous = state;
            if (previous == WaiterState.SHUTDOWN) {
                return;
            }
            state = WaiterState.SHUTDOWN;
            allReceived.signalAll();
        } finally {
            lock.unlock();
        }
        if (previous == WaiterState.IDLE) {
            logger.atDebug().addArgument(cfg.name()).log("Waiter {} shut down before starting");
            return;
        }
        release();
        logger.atInfo().addArgument(cfg.name()).log("Waiter {} shut down");
    }

    private void release() {
        cancelled.set(true);
        synchronized (lifecycle) {
            stopPump();
            for (TopicState topic : topics.values()) {
                if (topic.subscription() != null) {
                    try {
                        transport.unsubscribe(topic.subscription());
                    } catch (RuntimeException e) {
                        logger.atWarn()
                                .addArgument(topic.name())
                                .setCause(e)
                                .log("Error unsubscribing from {}");
                    }
                    topic.subscription(null);
                }
            }
            if (transport != null) {
                try {
                    transport.close();
                } catch (RuntimeException e) {
                    logger.atWarn()
                            .addArgument(cfg.name())
                            .setCause(e)
                            .log("Error closing transport for {}");
                }
            }
            if (executor != null) {
                executor.close();
            }
        }
    }

    private void stopPump() {
        if (pump == null) {
            return;
        }
        long grace = cfg.pollInterval().toMillis() * 2 + 100;
        try {
            pump.get(grace, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.atWarn()
                    .addArgument(cfg.name())
                    .addArgument(grace)
                    .log("Pump for {} did not stop within {}ms, interrupting");
            pump.cancel(true);
        } catch (ExecutionException e) {
            logger.atWarn()
                    .addArgument(cfg.name())
                    .setCause(e.getCause())
                    .log("Pump for {} failed");
        } catch (CancellationException e) {
            logger.atDebug().addArgument(cfg.name()).log("Pump for {} was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pump.cancel(true);
        }
    }

    /**
     * @return names of topics that have produced at least one message
     */
    public Set<String> topicsReceived() {
        lock.lock();
        try {
            var received = ImmutableSet.<String>builder();
            for (TopicState topic : topics.values()) {
                if (topic.received()) {
                    received.add(topic.name());
                }
            }
            return received.build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return names of topics that have not produced a message yet
     */
    public Set<String> topicsNotReceived() {
        lock.lock();
        try {
            return notReceivedLocked();
        } finally {
            lock.unlock();
        }
    }

    private Set<String> notReceivedLocked() {
        var notReceived = ImmutableSet.<String>builder();
        for (TopicState topic : topics.values()) {
            if (!topic.received()) {
                notReceived.add(topic.name());
            }
        }
        return notReceived.build();
    }

    /**
     * Returns the live buffer of a topic, holding at most the configured number
     * of most recent messages, oldest first. Polling from it drains the same
     * buffer that delivery appends to; synchronise on the returned queue for
     * compound operations such as iteration.
     *
     * @param topicName topic name as given at construction
     * @throws UnknownTopicException if the waiter was not created with this topic
     */
    public Queue<Object> receivedMessages(String topicName) {
        return state(topicName).buffer();
    }

    /**
     * Typed variant of {@link #receivedMessages(String)}.
     *
     * @throws UnknownTopicException    if the waiter was not created with this
     *                                  topic
     * @throws IllegalArgumentException if the topic carries messages that are not
     *                                  of {@code type}
     */
    @SuppressWarnings("unchecked")
    public <T> Queue<T> receivedMessages(String topicName, Class<T> type) {
        TopicState topic = state(topicName);
        if (!type.isAssignableFrom(topic.messageType())) {
            throw new IllegalArgumentException("Topic " + topicName + " carries "
                    + topic.messageType().getName() + ", not " + type.getName());
        }
        return (Queue<T>) (Queue<?>) topic.buffer();
    }

    private TopicState state(String topicName) {
        TopicState topic = topics.get(topicName);
        if (topic == null) {
            throw new UnknownTopicException(topicName);
        }
        return topic;
    }

    public WaiterState state() {
        return currentState();
    }

    private WaiterState currentState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return cfg.name();
    }

    public Duration timeout() {
        return cfg.timeout();
    }

    private class View implements WaitContext {

        @Override
        public String name() {
            return cfg.name();
        }

        @Override
        public Set<String> topicsReceived() {
            return TopicWaiter.this.topicsReceived();
        }

        @Override
        public Set<String> topicsNotReceived() {
            return TopicWaiter.this.topicsNotReceived();
        }

        @Override
        public Duration elapsed() {
            lock.lock();
            try {
                return state == WaiterState.IDLE ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - startedAt);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public Logger logger() {
            return logger;
        }
    }
}
