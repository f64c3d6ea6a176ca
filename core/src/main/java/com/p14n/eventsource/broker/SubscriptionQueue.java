package com.p14n.eventsource.broker;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.p14n.eventsource.data.Event;

/**
 * Bounded, closeable FIFO between the broker (and replay tasks) and the
 * connection that drains it.
 *
 * <p>
 * Writers never block: {@link #offer(Event)} reports failure when the queue is
 * full or closed. Once {@link #close() closed} the queue drops anything still
 * buffered, rejects further offers and wakes any waiting reader.
 * </p>
 */
public final class SubscriptionQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<Event> items;
    private final int capacity;
    private boolean closed;

    /**
     * @param capacity maximum number of buffered events
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public SubscriptionQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Adds an event without blocking.
     *
     * @param event the event
     * @return true if buffered, false if the queue is full or closed
     */
    public boolean offer(Event event) {
        lock.lock();
        try {
            if (closed || items.size() >= capacity) {
                return false;
            }
            items.addLast(event);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next event, waiting up to the given time for one to arrive.
     *
     * @param timeout how long to wait
     * @param unit    unit of the timeout
     * @return the next event, or null on timeout or when the queue is closed
     * @throws InterruptedException if interrupted while waiting
     */
    public Event poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (!closed && items.isEmpty()) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return closed ? null : items.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue. Safe to call more than once and from any thread.
     *
     * @return true if this call closed the queue, false if it was already closed
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            items.clear();
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
