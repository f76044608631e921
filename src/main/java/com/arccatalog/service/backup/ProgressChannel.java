package com.arccatalog.service.backup;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded, best-effort event channel between a running operation and its observer.
 * Publishing never blocks: when the channel is full the oldest event is dropped.
 * The operation's own return value or exception is authoritative, not the events.
 */
public class ProgressChannel<T> {
    public static final int DEFAULT_CAPACITY = 256;

    private final BlockingQueue<T> queue;
    private final AtomicLong dropped = new AtomicLong();

    public ProgressChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ProgressChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public void publish(T event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    public T poll() {
        return queue.poll();
    }

    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Removes and returns every pending event, oldest first.
     */
    public List<T> drain() {
        List<T> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public long getDroppedCount() {
        return dropped.get();
    }
}
