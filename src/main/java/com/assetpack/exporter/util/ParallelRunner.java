package com.assetpack.exporter.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.Value;

/**
 * Fixed worker pool that fans a task out over a collection and waits for every item.
 * <p>
 * Failures are isolated per item: a throwing item never stops the others, and
 * {@link #forEach(Collection, ItemTask)} reports every failure once all items have run.
 * Tasks must not submit further work to the same runner and wait for it.
 */
public class ParallelRunner implements AutoCloseable {

    /**
     * Work applied to a single item.
     */
    @FunctionalInterface
    public interface ItemTask<T> {
        void run(T item) throws Exception;
    }

    /**
     * An item whose task threw.
     */
    @Value
    public static class ItemFailure<T> {
        T item;
        Throwable cause;
    }

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final ExecutorService executor;
    private final int parallelism;

    public ParallelRunner() {
        this(Runtime.getRuntime().availableProcessors());
    }

    public ParallelRunner(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.executor = Executors.newFixedThreadPool(parallelism, daemonThreads());
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs {@code task} for every item, in no particular order, and blocks until all have finished.
     *
     * @return the failed items, empty when every item succeeded
     */
    public <T> List<ItemFailure<T>> forEach(Collection<? extends T> items, ItemTask<T> task) {
        List<T> submitted = new ArrayList<>(items.size());
        List<Future<?>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            submitted.add(item);
            futures.add(executor.submit(() -> {
                task.run(item);
                return null;
            }));
        }

        List<ItemFailure<T>> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                failures.add(new ItemFailure<>(submitted.get(i), e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while waiting for parallel tasks", e);
            }
        }
        return failures;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        int pool = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "export-worker-" + pool + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
