package com.example.realtime.gateway.subscriber;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded FIFO between the pub/sub receiver and the dispatcher. Offering to a full queue never
 * blocks and never fails: the oldest entry is evicted to make room.
 */
public class BackpressureQueue {

    private final int capacity;
    private final ArrayDeque<QueuedMessage> entries;
    private final ReentrantLock lock = new ReentrantLock();
    private long droppedCount;

    public BackpressureQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    /**
     * Appends at the tail.
     * @return {@code true} if the oldest entry was evicted to make room
     */
    public boolean offer(QueuedMessage message) {
        lock.lock();
        try {
            boolean evicted = false;
            if (entries.size() >= capacity) {
                entries.pollFirst();
                droppedCount++;
                evicted = true;
            }
            entries.addLast(message);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts a message back at the head, ahead of everything queued after it. When full, the newest
     * entry gives way.
     * @return {@code true} if an entry was evicted to make room
     */
    public boolean offerFirst(QueuedMessage message) {
        lock.lock();
        try {
            boolean evicted = false;
            if (entries.size() >= capacity) {
                entries.pollLast();
                droppedCount++;
                evicted = true;
            }
            entries.addFirst(message);
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns up to {@code max} entries from the head, oldest first.
     */
    public List<QueuedMessage> drain(int max) {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return Collections.emptyList();
            }
            int n = Math.min(max, entries.size());
            List<QueuedMessage> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(entries.pollFirst());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        lock.lock();
        try {
            return droppedCount;
        } finally {
            lock.unlock();
        }
    }
}
