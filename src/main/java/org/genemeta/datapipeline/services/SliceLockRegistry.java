package org.genemeta.datapipeline.services;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process locks serializing aggregation runs on the same {@code (disease, technology)} slice.
 * <p>
 * Across processes the row-version check of the statistics store is the only guard.
 */
public class SliceLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Waits up to {@code timeoutMs} for the slice lock.
     *
     * @return true if the lock was acquired.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public boolean tryLock(String sliceKey, long timeoutMs) throws InterruptedException {
        return locks.computeIfAbsent(sliceKey, k -> new ReentrantLock(true)).tryLock(timeoutMs, TimeUnit.MILLISECONDS);
    }

    public void unlock(String sliceKey) {
        ReentrantLock lock = locks.get(sliceKey);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("Slice lock " + sliceKey + " is not held by this thread");
        }
        lock.unlock();
    }

    boolean isLocked(String sliceKey) {
        ReentrantLock lock = locks.get(sliceKey);
        return lock != null && lock.isLocked();
    }
}
