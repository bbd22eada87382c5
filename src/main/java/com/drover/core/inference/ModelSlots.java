package com.drover.core.inference;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-model admission counters. Each model id admits at most {@code capacity} concurrent holders;
 * acquisition never blocks.
 */
public class ModelSlots {

    public static final int DEFAULT_CAPACITY = 4;

    private final int capacity;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public ModelSlots(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Slot capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    public ModelSlots() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Takes a slot if one is free.
     *
     * @return true if the caller now holds a slot, false if the model is at capacity
     */
    public boolean tryAcquire(String modelId) {
        Counter counter = counter(modelId);
        synchronized (counter) {
            if (counter.inUse >= capacity) {
                return false;
            }
            counter.inUse++;
            return true;
        }
    }

    /** Returns a slot; never drops below zero. */
    public void release(String modelId) {
        Counter counter = counter(modelId);
        synchronized (counter) {
            if (counter.inUse > 0) {
                counter.inUse--;
            }
        }
    }

    public boolean hasSlot(String modelId) {
        Counter counter = counter(modelId);
        synchronized (counter) {
            return counter.inUse < capacity;
        }
    }

    public int inUse(String modelId) {
        Counter counter = counter(modelId);
        synchronized (counter) {
            return counter.inUse;
        }
    }

    public int capacity() {
        return capacity;
    }

    private Counter counter(String modelId) {
        return counters.computeIfAbsent(modelId, k -> new Counter());
    }

    private static final class Counter {
        private int inUse;
    }
}
