package com.bridgeai.server.bridge;

import com.bridgeai.server.error.BridgeException;
import com.bridgeai.server.error.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Bounded circular buffer with many producers and one consumer. A full queue
 * rejects immediately; producers never block.
 */
public class RequestQueue {

    public enum Wake {
        SIGNALED,
        TIMED_OUT
    }

    private final QueueEntry[] slots;
    private int head = 0;
    private int tail = 0;
    private int count = 0;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    public RequestQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.slots = new QueueEntry[capacity];
    }

    public void enqueue(QueueEntry entry) {
        if (entry == null) {
            throw new BridgeException(ErrorCode.INVALID_ARGUMENT, "Queue entry is required");
        }
        lock.lock();
        try {
            if (count == slots.length) {
                throw new BridgeException(ErrorCode.CAPACITY_EXCEEDED,
                        "Request queue is full (" + slots.length + " entries)");
            }
            slots[tail] = entry;
            tail = (tail + 1) % slots.length;
            count++;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks once, for at most {@code timeoutNanos}, unless work is already
     * queued or {@code stopRequested} is already true. A spurious return counts
     * as a signal; callers drain on either outcome.
     */
    public Wake awaitWork(long timeoutNanos, BooleanSupplier stopRequested) throws InterruptedException {
        lock.lock();
        try {
            if (count > 0 || stopRequested.getAsBoolean()) {
                return Wake.SIGNALED;
            }
            long remaining = notEmpty.awaitNanos(timeoutNanos);
            return remaining > 0 ? Wake.SIGNALED : Wake.TIMED_OUT;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns everything queued at this moment, head to tail.
     * Entries enqueued afterwards stay for the next drain.
     */
    public List<QueueEntry> drainBatch() {
        lock.lock();
        try {
            int n = count;
            List<QueueEntry> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(slots[head]);
                slots[head] = null;
                head = (head + 1) % slots.length;
            }
            count = 0;
            return batch;
        } finally {
            lock.unlock();
        }
    }

    /** Wakes a consumer blocked in {@link #awaitWork}. */
    public void wakeConsumer() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int getCapacity() {
        return slots.length;
    }
}
