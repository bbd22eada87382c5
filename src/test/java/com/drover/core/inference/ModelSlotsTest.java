package com.drover.core.inference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ModelSlotsTest {

    @Test
    @DisplayName("the call after capacity is rejected without blocking")
    void rejectsBeyondCapacity() {
        var slots = new ModelSlots(2);
        assertTrue(slots.tryAcquire("m"));
        assertTrue(slots.tryAcquire("m"));
        assertFalse(slots.tryAcquire("m"));
        assertFalse(slots.hasSlot("m"));
        assertEquals(2, slots.inUse("m"));
    }

    @Test
    @DisplayName("models are counted independently")
    void independentModels() {
        var slots = new ModelSlots(1);
        assertTrue(slots.tryAcquire("a"));
        assertTrue(slots.tryAcquire("b"));
        assertFalse(slots.tryAcquire("a"));
    }

    @Test
    @DisplayName("release frees a slot and never goes below zero")
    void release() {
        var slots = new ModelSlots(1);
        slots.release("m");
        assertEquals(0, slots.inUse("m"));
        assertTrue(slots.tryAcquire("m"));
        slots.release("m");
        assertTrue(slots.tryAcquire("m"));
    }

    @Test
    @DisplayName("capacity below one is rejected")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ModelSlots(0));
    }

    @Test
    @DisplayName("concurrent acquirers never exceed capacity")
    void concurrentAcquire() throws Exception {
        var slots = new ModelSlots(3);
        var admitted = new AtomicInteger();
        var start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int i = 0; i < 16; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    if (slots.tryAcquire("m")) {
                        admitted.incrementAndGet();
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(3, admitted.get());
        assertEquals(3, slots.inUse("m"));
    }
}
