package com.p14n.eventsource.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a thread pool with
 * named daemon threads.
 *
 * <p>
 * The broker coordinator occupies one thread for its whole life and every
 * active replay takes another, so a fixed pool needs at least two threads.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        /**
         * Creates a new executor backed by a cached thread pool.
         */
        public DefaultExecutor() {
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a new executor backed by a fixed-size thread pool.
         *
         * @param fixedSize the size of the fixed thread pool
         * @throws IllegalArgumentException if fixedSize is less than 2
         */
        public DefaultExecutor(int fixedSize) {
                if (fixedSize < 2) {
                        throw new IllegalArgumentException("fixedSize must be at least 2, was " + fixedSize);
                }
                this.es = createFixedExecutorService(fixedSize);
        }

        /**
         * Creates a cached thread pool with named threads.
         *
         * @return a cached thread pool executor service
         */
        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("eventsource-worker-%d").setDaemon(true)
                                                .build());
        }

        /**
         * Creates a fixed-size thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a fixed thread pool executor service
         */
        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("eventsource-fixed-%d").setDaemon(true)
                                                .build());
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
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
