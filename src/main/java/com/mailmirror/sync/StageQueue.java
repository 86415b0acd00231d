package com.mailmirror.sync;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded queue between two pipeline stages.
 * - close(): producer is done, consumer drains what is left
 * - abort(): either side gave up, pending and future items are dropped and waiters wake up
 */
class StageQueue<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final Deque<T> items;
    private final int capacity;

    private boolean closed;
    private boolean aborted;

    StageQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Blocks while the queue is full
     *
     * @return false if the queue was aborted and the item dropped
     * @throws IllegalStateException if the queue was closed
     */
    boolean put(T item) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!aborted && !closed && items.size() >= capacity) {
                notFull.await();
            }
            if (aborted) {
                return false;
            }
            if (closed) {
                throw new IllegalStateException("put after close");
            }
            items.addLast(item);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void abort() {
        lock.lock();
        try {
            aborted = true;
            items.clear();
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    boolean isAborted() {
        lock.lock();
        try {
            return aborted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks while the queue is empty and open
     *
     * @return the next item, or null once closed and drained or aborted
     */
    T take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!aborted && !closed && items.isEmpty()) {
                notEmpty.await();
            }
            if (aborted) {
                return null;
            }
            T item = items.pollFirst();
            if (item != null) {
                notFull.signal();
            }
            return item;
        } finally {
            lock.unlock();
        }
    }
}
