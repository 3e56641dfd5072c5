package com.boxsort.util;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keyed mutual exclusion for single-row mutations.
 *
 * One fair {@link ReentrantLock} exists per key (for example
 * {@code "job-1:box:3:barcode:X"}), so callers touching different rows never
 * wait on each other. Entries are created lazily and kept for the life of the
 * registry; the key space is bounded by the number of requirement rows.
 */
public class RowLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     *
     * @param key     the row key
     * @param timeout maximum time to wait for the lock
     * @param action  work to perform under the lock
     * @return the action's result
     * @throws LockTimeoutException if the lock could not be acquired in time,
     *                              or the waiting thread was interrupted
     */
    public <T> T withLock(String key, Duration timeout, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, e);
        }
        if (!acquired) {
            throw new LockTimeoutException(key, null);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks if the given key is currently locked by any thread.
     */
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }

    /**
     * Returns the number of currently tracked lock keys.
     */
    public int getLockCount() {
        return locks.size();
    }

    public static class LockTimeoutException extends RuntimeException {

        private final String key;

        public LockTimeoutException(String key, Throwable cause) {
            super("Timed out waiting for lock " + key, cause);
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }
}
