package com.codemeter.core.backend;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded multi-consumer work queue with drain support.
 *
 * <p>Guarded by one lock and three conditions: {@code notEmpty} wakes consumers,
 * {@code notFull} wakes a producer blocked on a full queue, {@code drained} wakes the thread
 * waiting in {@link #awaitDrained()}. The queue also counts consumers that are in the middle of
 * an item, so "drained" means both "no queued items" and "no item in progress".
 *
 * <p>Producers block while the queue is full; once draining starts every blocked and every later
 * {@link #put} is rejected. Items accepted before that are never dropped.
 *
 * @param <T> item type
 */
public final class BoundedWorkQueue<T> {

    private final int capacity;
    private final ArrayDeque<T> items;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Condition drained = lock.newCondition();

    private PoolState state = PoolState.RUNNING;
    private int activeConsumers;
    private int liveConsumers;

    /**
     * Creates a queue.
     *
     * @param capacity maximum number of queued items, at least 1
     */
    public BoundedWorkQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Enqueues an item, blocking while the queue is full.
     *
     * @param item item to enqueue
     * @return true if accepted, false if draining has started
     * @throws InterruptedException if interrupted while waiting for space
     */
    public boolean put(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.size() >= capacity && state == PoolState.RUNNING) {
                notFull.await();
            }
            if (state != PoolState.RUNNING) {
                return false;
            }
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next item, blocking while the queue is empty and still running. The caller
     * becomes an active consumer and must call {@link #complete()} when done with the item.
     *
     * @return next item, or {@code null} once draining has started and the queue is empty
     * @throws InterruptedException if interrupted while waiting
     */
    public T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty()) {
                if (state != PoolState.RUNNING) {
                    return null;
                }
                notEmpty.await();
            }
            T item = items.pollFirst();
            activeConsumers++;
            notFull.signal();
            return item;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the item obtained from the last {@link #take()} as finished.
     */
    public void complete() {
        lock.lock();
        try {
            if (activeConsumers == 0) {
                throw new IllegalStateException("complete() without a matching take()");
            }
            activeConsumers--;
            signalIfDrained();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers a consumer thread about to start.
     */
    public void consumerStarted() {
        lock.lock();
        try {
            liveConsumers++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unregisters a consumer thread that is about to exit.
     */
    public void consumerExited() {
        lock.lock();
        try {
            liveConsumers--;
            drained.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting items and wakes every waiting producer and consumer.
     */
    public void beginDrain() {
        lock.lock();
        try {
            if (state == PoolState.RUNNING) {
                state = PoolState.DRAINING;
            }
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the queue is empty and no consumer is mid-item, then moves to
     * {@link PoolState#STOPPED}. Returns early if every consumer has exited with items left.
     *
     * @return true if all queued work completed, false if work was left with no consumer to run it
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitDrained() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (state == PoolState.RUNNING) {
                throw new IllegalStateException("beginDrain() must be called first");
            }
            while ((!items.isEmpty() || activeConsumers > 0) && liveConsumers > 0) {
                drained.await();
            }
            boolean complete = items.isEmpty() && activeConsumers == 0;
            items.clear();
            state = PoolState.STOPPED;
            return complete;
        } finally {
            lock.unlock();
        }
    }

    private void signalIfDrained() {
        if (items.isEmpty() && activeConsumers == 0) {
            drained.signalAll();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int activeConsumers() {
        lock.lock();
        try {
            return activeConsumers;
        } finally {
            lock.unlock();
        }
    }

    public PoolState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }
}
