package com.warewise.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for the analysis worker pool.
 *
 * Canonicalization and rule evaluation are pure CPU work, so the pool is bounded by CPU count.
 * Every task runs with the submitting thread's MDC (analysisId, warehouseId).
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.worker-threads:0}")
    private int workerThreads;

    /**
     * Creates a fixed worker pool with MDC propagation.
     */
    @Bean("analysisExecutor")
    public ExecutorService analysisExecutor() {
        int threads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        log.info("Creating analysis executor with {} worker threads and MDC propagation", threads);
        return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(threads, workerThreadFactory()));
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "analysis-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Copies the caller's MDC into each task and clears it afterwards.
     */
    static final class MdcPropagatingExecutorService implements ExecutorService {

        private final ExecutorService delegate;

        MdcPropagatingExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        private <T> Callable<T> wrap(Callable<T> callable) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return callable.call();
                } finally {
                    MDC.clear();
                }
            };
        }

        private Runnable wrap(Runnable runnable) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }

        private <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
            return tasks.stream().<Callable<T>>map(task -> wrap(task)).toList();
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrap(command));
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public Future<?> submit(Runnable task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(wrap(task), result);
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks));
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks), timeout, unit);
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks) throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapAll(tasks));
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapAll(tasks), timeout, unit);
        }

        // Boilerplate delegate methods
        @Override
        public void shutdown() { delegate.shutdown(); }
        @Override
        public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override
        public boolean isShutdown() { return delegate.isShutdown(); }
        @Override
        public boolean isTerminated() { return delegate.isTerminated(); }
        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }
}
