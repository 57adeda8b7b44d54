package com.cinematic.engine.dispatch;

import com.cinematic.core.model.ResourceClass;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of worker slots for one resource class, shared by every project.
 * A slot is acquired before a stage is dispatched and released when the stage finishes.
 */
public class ResourcePool {

    private final ResourceClass resourceClass;
    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inUse = new AtomicInteger();
    private final AtomicInteger peakInUse = new AtomicInteger();

    public ResourcePool(ResourceClass resourceClass, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be >= 1");
        }
        this.resourceClass = resourceClass;
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Block until a slot is free.
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        int now = inUse.incrementAndGet();
        peakInUse.accumulateAndGet(now, Math::max);
    }

    public boolean tryAcquire() {
        if (!permits.tryAcquire()) {
            return false;
        }
        int now = inUse.incrementAndGet();
        peakInUse.accumulateAndGet(now, Math::max);
        return true;
    }

    public void release() {
        if (inUse.getAndUpdate(n -> Math.max(0, n - 1)) == 0) {
            throw new IllegalStateException("Release without acquire on " + resourceClass + " pool");
        }
        permits.release();
    }

    public ResourceClass resourceClass() {
        return resourceClass;
    }

    public int capacity() {
        return capacity;
    }

    public int inUse() {
        return inUse.get();
    }

    public int available() {
        return permits.availablePermits();
    }

    /**
     * Highest number of slots held at once since creation.
     */
    public int peakInUse() {
        return peakInUse.get();
    }
}
