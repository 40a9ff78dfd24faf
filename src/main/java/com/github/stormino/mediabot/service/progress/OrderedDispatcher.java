package com.github.stormino.mediabot.service.progress;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Hands items to a consumer on an executor, one at a time and in submission order.
 *
 * <p>{@link #accept} never blocks: items wait in an unbounded queue while the consumer is busy,
 * so a slow or stuck consumer only delays delivery. At most one drain task is scheduled at a
 * time. A consumer that throws is logged and keeps receiving later items.</p>
 */
@Slf4j
public class OrderedDispatcher<T> implements Consumer<T> {

    private final Queue<T> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final Object idleLock = new Object();
    private final Consumer<T> consumer;
    private final Executor executor;
    private final String name;

    public OrderedDispatcher(@NonNull String name, @NonNull Consumer<T> consumer, @NonNull Executor executor) {
        this.name = name;
        this.consumer = consumer;
        this.executor = executor;
    }

    @Override
    public void accept(T item) {
        pending.offer(item);
        schedule();
    }

    /**
     * Items accepted but not yet handed to the consumer.
     */
    public int backlog() {
        return pending.size();
    }

    /**
     * Wait until every accepted item has been handed over, or the timeout passes.
     *
     * @return false when items were still pending at the deadline
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleLock) {
            while (draining.get() || !pending.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(idleLock, remaining);
            }
            return true;
        }
    }

    private void schedule() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("{} dispatch rejected, dropping {} queued item(s): {}", name, pending.size(), e.getMessage());
            pending.clear();
            markIdle();
        }
    }

    private void drain() {
        try {
            T item;
            while ((item = pending.poll()) != null) {
                try {
                    consumer.accept(item);
                } catch (RuntimeException e) {
                    log.warn("{} consumer failed: {}", name, e.getMessage());
                }
            }
        } finally {
            markIdle();
        }
        // an item offered after the last poll but before the flag cleared
        if (!pending.isEmpty()) {
            schedule();
        }
    }

    private void markIdle() {
        draining.set(false);
        synchronized (idleLock) {
            idleLock.notifyAll();
        }
    }
}
