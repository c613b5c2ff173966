package com.p14n.topicwait.broker;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a scheduled pool
 * and a fixed-size pool, both with named daemon threads.
 *
 * <p>
 * A topic waiter owns one of these for its pump, so the thread names carry
 * the waiter's name for debugging.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;
        private final ExecutorService es;

        /**
         * Creates a new executor with both scheduled and fixed-size thread pools.
         *
         * @param scheduledSize the size of the scheduled thread pool
         * @param fixedSize     the size of the fixed thread pool
         */
        public DefaultExecutor(int scheduledSize, int fixedSize) {
                this("topic-wait", scheduledSize, fixedSize);
        }

        /**
         * Creates a new executor whose thread names start with the given prefix.
         *
         * @param namePrefix    prefix for every thread name
         * @param scheduledSize the size of the scheduled thread pool
         * @param fixedSize     the size of the fixed thread pool
         */
        public DefaultExecutor(String namePrefix, int scheduledSize, int fixedSize) {
                this.se = createScheduledExecutorService(namePrefix, scheduledSize);
                this.es = createFixedExecutorService(namePrefix, fixedSize);
        }

        /**
         * Creates a fixed-size thread pool with named threads.
         *
         * @param namePrefix prefix for every thread name
         * @param size       the number of threads in the pool
         * @return a fixed thread pool executor service
         */
        protected ExecutorService createFixedExecutorService(String namePrefix, int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder()
                                                .setNameFormat(namePrefix + "-fixed-%d")
                                                .setDaemon(true)
                                                .build());
        }

        /**
         * Creates a scheduled thread pool with named threads.
         *
         * @param namePrefix prefix for every thread name
         * @param size       the number of threads in the pool
         * @return a scheduled thread pool executor service
         */
        protected ScheduledExecutorService createScheduledExecutorService(String namePrefix, int size) {
                return Executors.newScheduledThreadPool(size,
                                new ThreadFactoryBuilder()
                                                .setNameFormat(namePrefix + "-scheduled-%d")
                                                .setDaemon(true)
                                                .build());
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                var x = new ArrayList<Runnable>();
                x.addAll(es.shutdownNow());
                x.addAll(se.shutdownNow());
                return x;
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
